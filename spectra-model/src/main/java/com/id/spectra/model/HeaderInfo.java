package com.id.spectra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeaderInfo {

    public static final String UNKNOWN = "Unknown";

    private String filename;
    @Builder.Default
    private String target = UNKNOWN;
    @Builder.Default
    private String instrument = UNKNOWN;
    @Builder.Default
    private String filter = UNKNOWN;
    @Builder.Default
    private String grating = UNKNOWN;
    @Builder.Default
    private String obsDate = UNKNOWN;
    @Builder.Default
    private String exposureTime = UNKNOWN;
    @Builder.Default
    private String fluxUnit = UNKNOWN;

}
