package com.id.spectra.modules.pipeline.model;

import com.id.spectra.model.SpectralDataset;

import java.util.List;

public record RangeFilterOutcome(SpectralDataset dataset, List<String> rangeInfo, List<String> warnings) {

    public boolean applied() {
        return !rangeInfo.isEmpty();
    }
}
