package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsHdu;
import com.id.spectra.modules.loader.model.FitsLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

@Slf4j
public class EmbeddedTimeTableHandler implements IFitsLayoutHandler {

    @Override
    public FitsLayout layout() {
        return FitsLayout.EMBEDDED_TIME_TABLE;
    }

    @Override
    public void collect(FitsContainer container, double[] midTimes, IntegrationCollector collector) throws IOException {
        FitsHdu table = container.find(FitsNames.EXTRACT1D)
                .orElseThrow(() -> new IOException("No EXTRACT1D extension"));
        String timeColumn = FitsLayoutDetector.timeColumn(table)
                .orElseThrow(() -> new IOException("EXTRACT1D has no time column"));
        log.info("Reading {} integrations from table, time column {}", table.rowCount(), timeColumn);

        TableRows rows = TableRows.read(table);
        double[] times = table.column(timeColumn);
        int total = rows.count();
        for (int i = 0; i < total; i++) {
            if (i >= times.length) {
                collector.skip(i + 1, "no timestamp");
                continue;
            }
            try {
                collector.accept(i + 1, total, rows.wavelength(i), rows.flux(i), rows.error(i), times[i]);
            } catch (RuntimeException e) {
                log.error("Error processing integration {}: {}", i + 1, e.getMessage(), e);
                collector.skip(i + 1, e.getMessage());
            }
        }
    }
}
