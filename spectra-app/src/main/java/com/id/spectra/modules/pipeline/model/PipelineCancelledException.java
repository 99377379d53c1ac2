package com.id.spectra.modules.pipeline.model;

public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException() {
        super("Job cancelled");
    }
}
