package com.id.spectra.modules.jobs.model;

public enum JobStage {
    QUEUED,
    SCAN,
    READ,
    REGRID,
    INTERPOLATE,
    FINALIZE,
    DONE,
    ERROR
}
