package com.id.spectra.modules.jobs.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.id.spectra.modules.visits.model.Visit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DisplayGrid {

    private ZAxisDisplay mode;
    private double[] wavelength;
    private double[] timeHours;
    private double[][] z;
    private double[][] errors;
    private double[] referenceSpectrum;
    private List<Visit> visits;
    private int binSize;
    private String colorscale;
    private ValueRange colorRange;
    private List<CustomBand> customBands;

}
