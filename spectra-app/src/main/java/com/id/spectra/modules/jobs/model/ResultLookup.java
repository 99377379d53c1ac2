package com.id.spectra.modules.jobs.model;

public record ResultLookup(ResultState state, JobResultPayload payload, String message) {

    public enum ResultState {
        NOT_FOUND,
        NOT_READY,
        FAILED,
        READY
    }

    public static ResultLookup notFound() {
        return new ResultLookup(ResultState.NOT_FOUND, null, "unknown job");
    }

    public static ResultLookup notReady() {
        return new ResultLookup(ResultState.NOT_READY, null, "not ready");
    }

    public static ResultLookup failed(String message) {
        return new ResultLookup(ResultState.FAILED, null, message);
    }

    public static ResultLookup ready(JobResultPayload payload) {
        return new ResultLookup(ResultState.READY, payload, null);
    }
}
