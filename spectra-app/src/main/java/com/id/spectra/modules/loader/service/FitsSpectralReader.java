package com.id.spectra.modules.loader.service;

import com.id.spectra.model.HeaderInfo;
import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsContainerOpener;
import com.id.spectra.modules.loader.container.FitsHdu;
import com.id.spectra.modules.loader.logic.EmbeddedTimeTableHandler;
import com.id.spectra.modules.loader.logic.FitsHeaderReader;
import com.id.spectra.modules.loader.logic.FitsLayoutDetector;
import com.id.spectra.modules.loader.logic.FitsNames;
import com.id.spectra.modules.loader.logic.IFitsLayoutHandler;
import com.id.spectra.modules.loader.logic.IndexedExtensionsHandler;
import com.id.spectra.modules.loader.logic.IntegrationCollector;
import com.id.spectra.modules.loader.logic.SeparateTimeTableHandler;
import com.id.spectra.modules.loader.model.FitsLayout;
import com.id.spectra.modules.loader.model.IntegrationCallback;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class FitsSpectralReader implements ISpectralFileReader {

    private final FitsContainerOpener opener;
    private final Map<FitsLayout, IFitsLayoutHandler> handlers = new EnumMap<>(FitsLayout.class);

    public FitsSpectralReader(FitsContainerOpener opener) {
        this.opener = opener;
        for (IFitsLayoutHandler handler : List.of(
                new EmbeddedTimeTableHandler(),
                new SeparateTimeTableHandler(),
                new IndexedExtensionsHandler())) {
            handlers.put(handler.layout(), handler);
        }
    }

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".fits");
    }

    @Override
    public ScanResult scan(Path path) {
        try (FitsContainer container = opener.open(path)) {
            Optional<FitsHdu> intTimes = container.find(FitsNames.INT_TIMES);
            if (intTimes.isEmpty() || !intTimes.get().hasColumn(FitsNames.INT_MID_MJD)) {
                return ScanResult.empty(path);
            }
            double[] mids = intTimes.get().column(FitsNames.INT_MID_MJD);
            return new ScanResult(path, mids.length, mids.length > 0 ? mids[0] : null);
        } catch (Exception e) {
            log.warn("Scan failed for {}: {}", path.getFileName(), e.getMessage());
            return ScanResult.empty(path);
        }
    }

    @Override
    public Optional<LoadedFile> load(Path path, IntegrationCallback callback) {
        String filename = path.getFileName().toString();
        log.info("Loading FITS file {}", filename);
        try (FitsContainer container = opener.open(path)) {
            // Find time table
            Optional<FitsHdu> intTimes = container.find(FitsNames.INT_TIMES);
            if (intTimes.isEmpty() || !intTimes.get().hasColumn(FitsNames.INT_MID_MJD)) {
                log.error("{}: no {} extension found", filename, FitsNames.INT_TIMES);
                return Optional.empty();
            }
            double[] mids = intTimes.get().column(FitsNames.INT_MID_MJD);
            log.info("{}: found {} with {} entries", filename, FitsNames.INT_TIMES, mids.length);

            // Pick layout
            Optional<FitsLayout> layout = FitsLayoutDetector.detect(container);
            if (layout.isEmpty()) {
                log.error("{}: no {} extension found", filename, FitsNames.EXTRACT1D);
                return Optional.empty();
            }
            log.info("{}: {} layout {}", filename, FitsNames.EXTRACT1D, layout.get());

            HeaderInfo headerInfo = FitsHeaderReader.read(container, filename);
            IntegrationCollector collector = new IntegrationCollector(filename, callback);
            handlers.get(layout.get()).collect(container, mids, collector);

            log.info("{}: loaded {} integrations from {} {} entries ({} skipped)",
                    filename, collector.integrations().size(), mids.length, FitsNames.INT_TIMES, collector.skipped());
            if (collector.isEmpty()) {
                log.error("{}: no integrations were successfully loaded", filename);
                return Optional.empty();
            }
            return Optional.of(new LoadedFile(List.copyOf(collector.integrations()), headerInfo));
        } catch (Exception e) {
            log.error("Error loading FITS file {}: {}", filename, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
