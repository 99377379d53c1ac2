package com.id.spectra.modules.loader.container;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over one header/data unit of a FITS file.
 */
public interface FitsHdu {

    /**
     * @return EXTNAME, or {@code PRIMARY} for the first HDU without one
     */
    String name();

    /**
     * @return EXTVER, 1 when absent
     */
    int version();

    Optional<String> header(String key);

    boolean isTable();

    int rowCount();

    List<String> columnNames();

    /**
     * All values of a column, row after row.
     */
    double[] column(String name) throws IOException;

    /**
     * One vector per table row.
     */
    double[][] rows(String name) throws IOException;

    /**
     * @return values per row of the column, from the TFORMn repeat count; 1 for scalar columns,
     * 0 when the column is absent
     */
    default int columnWidth(String name) {
        List<String> names = columnNames();
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).equalsIgnoreCase(name)) {
                return header("TFORM" + (i + 1)).map(FitsHdu::repeatCount).orElse(1);
            }
        }
        return 0;
    }

    private static int repeatCount(String tform) {
        int end = 0;
        while (end < tform.length() && Character.isDigit(tform.charAt(end))) {
            end++;
        }
        return end == 0 ? 1 : Integer.parseInt(tform.substring(0, end));
    }

    default boolean hasColumn(String name) {
        return columnNames().stream().anyMatch(c -> c.equalsIgnoreCase(name));
    }
}
