package com.id.spectra.modules.loader.model;

@FunctionalInterface
public interface IntegrationCallback {

    IntegrationCallback NONE = (done, totalHint) -> {
    };

    void onIntegration(int done, int totalHint);
}
