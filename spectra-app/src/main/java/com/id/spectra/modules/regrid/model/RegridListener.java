package com.id.spectra.modules.regrid.model;

@FunctionalInterface
public interface RegridListener {

    RegridListener NONE = (done, total, throughput) -> {
    };

    void onIntegration(int done, int total, Double throughput);
}
