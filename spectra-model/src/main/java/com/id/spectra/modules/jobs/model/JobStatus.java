package com.id.spectra.modules.jobs.model;

public enum JobStatus {
    RUNNING,
    DONE,
    ERROR,
    CANCELLED
}
