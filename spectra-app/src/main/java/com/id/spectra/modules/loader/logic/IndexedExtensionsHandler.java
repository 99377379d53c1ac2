package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsHdu;
import com.id.spectra.modules.loader.model.FitsLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

@Slf4j
public class IndexedExtensionsHandler implements IFitsLayoutHandler {

    @Override
    public FitsLayout layout() {
        return FitsLayout.INDEXED_EXTENSIONS;
    }

    @Override
    public void collect(FitsContainer container, double[] midTimes, IntegrationCollector collector) {
        int total = midTimes.length;
        log.info("Reading {} individual {} extensions", total, FitsNames.EXTRACT1D);
        for (int index = 1; index <= total; index++) {
            Optional<FitsHdu> extension = container.find(FitsNames.EXTRACT1D, index);
            if (extension.isEmpty()) {
                collector.skip(index, "extension " + FitsNames.EXTRACT1D + "," + index + " not found");
                continue;
            }
            try {
                FitsHdu hdu = extension.get();
                double[] flux = hdu.column(FitsNames.FLUX);
                double[] error = hdu.hasColumn(FitsNames.FLUX_ERROR) ? hdu.column(FitsNames.FLUX_ERROR) : null;
                collector.accept(index, total, hdu.column(FitsNames.WAVELENGTH), flux, error, midTimes[index - 1]);
            } catch (IOException | RuntimeException e) {
                log.error("Error processing integration {}: {}", index, e.getMessage(), e);
                collector.skip(index, e.getMessage());
            }
        }
    }
}
