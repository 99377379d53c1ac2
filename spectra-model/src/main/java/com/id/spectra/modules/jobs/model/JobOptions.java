package com.id.spectra.modules.jobs.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobOptions {

    private boolean useInterpolation;
    @Builder.Default
    private String colorscale = "Viridis";
    private Integer numIntegrations;
    @Builder.Default
    private ZAxisDisplay displayMode = ZAxisDisplay.VARIABILITY;
    private ValueRange timeRange;
    private ValueRange wavelengthRange;
    private ValueRange variabilityRange;
    @Builder.Default
    private List<CustomBand> customBands = new ArrayList<>();
    private boolean useDemo;

}
