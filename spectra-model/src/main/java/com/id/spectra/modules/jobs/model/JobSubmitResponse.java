package com.id.spectra.modules.jobs.model;

public record JobSubmitResponse(String jobId) {
}
