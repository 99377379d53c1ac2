package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsHdu;
import com.id.spectra.modules.loader.model.FitsLayout;

import java.util.List;
import java.util.Optional;

/**
 * Tells which EXTRACT1D arrangement a FITS file uses. Checks run in priority order: a single
 * table with its own time column, a single table relying on INT_TIMES, then per-integration
 * extensions. A lone EXTRACT1D with scalar FLUX holds one spectrum, one sample per row, so it is
 * read as the first indexed extension.
 */
public final class FitsLayoutDetector {

    private FitsLayoutDetector() {
    }

    public static Optional<FitsLayout> detect(FitsContainer container) {
        List<FitsHdu> extracts = container.findAll(FitsNames.EXTRACT1D);
        if (extracts.isEmpty()) {
            return Optional.empty();
        }
        FitsHdu first = extracts.get(0);
        boolean singleTable = extracts.size() == 1 && first.isTable() && first.rowCount() > 0
                && first.columnWidth(FitsNames.FLUX) > 1;
        if (singleTable && timeColumn(first).isPresent()) {
            return Optional.of(FitsLayout.EMBEDDED_TIME_TABLE);
        }
        if (singleTable) {
            return Optional.of(FitsLayout.SEPARATE_TIME_TABLE);
        }
        return Optional.of(FitsLayout.INDEXED_EXTENSIONS);
    }

    /**
     * @return the first time column present in the table, following {@link FitsNames#TIME_COLUMNS}
     */
    public static Optional<String> timeColumn(FitsHdu table) {
        return FitsNames.TIME_COLUMNS.stream()
                .filter(table::hasColumn)
                .findFirst();
    }
}
