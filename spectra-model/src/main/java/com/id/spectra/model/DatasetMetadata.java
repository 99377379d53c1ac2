package com.id.spectra.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive metadata attached to a {@link SpectralDataset}: counts, the instrument/target sets
 * seen across the batch, flux unit and the description of any user range applied.
 * <p>
 * Read-only; amended versions are derived through {@link #toBuilder()}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetMetadata {

    private int totalIntegrations;
    private int plottedIntegrations;
    private int filesProcessed;
    private String wavelengthRange;
    private String timeRange;
    @Builder.Default
    private List<String> targets = new ArrayList<>();
    @Builder.Default
    private List<String> instruments = new ArrayList<>();
    @Builder.Default
    private List<String> filters = new ArrayList<>();
    @Builder.Default
    private List<String> gratings = new ArrayList<>();
    @Builder.Default
    private String fluxUnit = HeaderInfo.UNKNOWN;
    private boolean interpolated;
    private String userRanges;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public List<String> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    public List<String> getInstruments() {
        return Collections.unmodifiableList(instruments);
    }

    public List<String> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    public List<String> getGratings() {
        return Collections.unmodifiableList(gratings);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * @return a copy carrying {@code extra} after the existing warnings
     */
    public DatasetMetadata withWarnings(List<String> extra) {
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extra);
        return toBuilder().warnings(merged).build();
    }
}
