package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsHdu;
import com.id.spectra.modules.loader.model.FitsLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

@Slf4j
public class SeparateTimeTableHandler implements IFitsLayoutHandler {

    @Override
    public FitsLayout layout() {
        return FitsLayout.SEPARATE_TIME_TABLE;
    }

    @Override
    public void collect(FitsContainer container, double[] midTimes, IntegrationCollector collector) throws IOException {
        FitsHdu table = container.find(FitsNames.EXTRACT1D)
                .orElseThrow(() -> new IOException("No EXTRACT1D extension"));
        log.info("Reading {} integrations from table, times from {}", midTimes.length, FitsNames.INT_TIMES);

        TableRows rows = TableRows.read(table);
        int total = midTimes.length;
        for (int i = 0; i < total; i++) {
            if (i >= rows.count()) {
                collector.skip(i + 1, "table only has " + rows.count() + " rows");
                continue;
            }
            try {
                collector.accept(i + 1, total, rows.wavelength(i), rows.flux(i), rows.error(i), midTimes[i]);
            } catch (RuntimeException e) {
                log.error("Error processing integration {}: {}", i + 1, e.getMessage(), e);
                collector.skip(i + 1, e.getMessage());
            }
        }
    }
}
