package com.id.spectra.modules.jobs.model;

import com.id.spectra.model.DatasetMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobResultPayload {

    private String jobId;
    private double[] wavelength;
    private double[][] fluxRaw;
    private double[][] fluxNormalized;
    private double[][] errorRaw;
    private double[] timeHours;
    private DatasetMetadata metadata;
    private DisplayGrid display;
    private boolean fromCache;

}
