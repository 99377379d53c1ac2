package com.id.spectra.modules.pipeline.model;

import com.id.spectra.modules.jobs.model.ProgressUpdate;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = update -> {
    };

    void onProgress(ProgressUpdate update);
}
