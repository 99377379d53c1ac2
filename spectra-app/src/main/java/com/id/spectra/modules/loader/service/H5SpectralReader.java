package com.id.spectra.modules.loader.service;

import com.id.spectra.model.HeaderInfo;
import com.id.spectra.modules.loader.container.ArrayConversions;
import com.id.spectra.modules.loader.container.ColumnarContainer;
import com.id.spectra.modules.loader.container.ColumnarContainerOpener;
import com.id.spectra.modules.loader.logic.ColumnarLayouts;
import com.id.spectra.modules.loader.logic.IntegrationCollector;
import com.id.spectra.modules.loader.model.FieldCandidate;
import com.id.spectra.modules.loader.model.IntegrationCallback;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import com.id.spectra.modules.loader.model.SpectralQuantity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
public class H5SpectralReader implements ISpectralFileReader {

    private final ColumnarContainerOpener opener;

    public H5SpectralReader(ColumnarContainerOpener opener) {
        this.opener = opener;
    }

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".h5");
    }

    @Override
    public ScanResult scan(Path path) {
        try (ColumnarContainer container = opener.open(path)) {
            Optional<FieldCandidate> flux = ColumnarLayouts.resolve(container, SpectralQuantity.FLUX);
            Optional<FieldCandidate> time = ColumnarLayouts.resolve(container, SpectralQuantity.TIME);
            if (flux.isEmpty()) {
                return ScanResult.empty(path);
            }
            int[] shape = container.shape(flux.get().name());
            int count = shape.length > 0 ? shape[0] : 0;
            Double firstTime = null;
            if (time.isPresent()) {
                double[] times = ArrayConversions.flatten(container.read(time.get().name()));
                firstTime = times.length > 0 ? times[0] : null;
            }
            return new ScanResult(path, count, firstTime);
        } catch (Exception e) {
            log.warn("Scan failed for {}: {}", path.getFileName(), e.getMessage());
            return ScanResult.empty(path);
        }
    }

    @Override
    public Optional<LoadedFile> load(Path path, IntegrationCallback callback) {
        String filename = path.getFileName().toString();
        log.info("Loading HDF5 file {}", filename);
        try (ColumnarContainer container = opener.open(path)) {
            Optional<FieldCandidate> fluxField = ColumnarLayouts.resolve(container, SpectralQuantity.FLUX);
            Optional<FieldCandidate> waveField = ColumnarLayouts.resolve(container, SpectralQuantity.WAVELENGTH);
            Optional<FieldCandidate> timeField = ColumnarLayouts.resolve(container, SpectralQuantity.TIME);
            Optional<FieldCandidate> errorField = ColumnarLayouts.resolve(container, SpectralQuantity.ERROR);
            if (fluxField.isEmpty() || waveField.isEmpty() || timeField.isEmpty()) {
                log.error("{}: missing flux, wavelength or time dataset", filename);
                return Optional.empty();
            }

            int[] fluxShape = container.shape(fluxField.get().name());
            int count = fluxShape.length > 0 ? fluxShape[0] : 0;
            double[][] flux = readRows(container, fluxField.get(), count);
            double[] time = readVector(container, timeField.get());
            double[][] error = errorField.isPresent() ? readRows(container, errorField.get(), count) : null;
            Object rawWavelength = container.read(waveField.get().name());
            boolean perRowWavelength = container.shape(waveField.get().name()).length > 1;
            double[][] waveRows = perRowWavelength ? ArrayConversions.toRows(rawWavelength, count) : null;
            double[] sharedWave = perRowWavelength ? null : ArrayConversions.flatten(rawWavelength);

            IntegrationCollector collector = new IntegrationCollector(filename, callback);
            for (int i = 0; i < flux.length; i++) {
                if (i >= time.length) {
                    collector.skip(i + 1, "no timestamp");
                    continue;
                }
                try {
                    double[] wavelength = perRowWavelength ? waveRows[i] : sharedWave;
                    double[] err = error != null && i < error.length ? error[i] : null;
                    collector.accept(i + 1, flux.length, wavelength, flux[i], err, time[i]);
                } catch (RuntimeException e) {
                    log.error("Error processing integration {}: {}", i + 1, e.getMessage(), e);
                    collector.skip(i + 1, e.getMessage());
                }
            }

            log.info("{}: loaded {} integrations ({} skipped)", filename, collector.integrations().size(), collector.skipped());
            if (collector.isEmpty()) {
                return Optional.empty();
            }
            HeaderInfo headerInfo = HeaderInfo.builder().filename(filename).build();
            return Optional.of(new LoadedFile(List.copyOf(collector.integrations()), headerInfo));
        } catch (Exception e) {
            log.error("Error loading HDF5 file {}: {}", filename, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static double[] readVector(ColumnarContainer container, FieldCandidate field) throws IOException {
        double[] values = ArrayConversions.flatten(container.read(field.name()));
        return Arrays.stream(values).map(field.transform()).toArray();
    }

    private static double[][] readRows(ColumnarContainer container, FieldCandidate field, int count) throws IOException {
        double[][] rows = ArrayConversions.toRows(container.read(field.name()), count);
        for (int r = 0; r < rows.length; r++) {
            rows[r] = Arrays.stream(rows[r]).map(field.transform()).toArray();
        }
        return rows;
    }
}
