package com.id.spectra.modules.loader.container;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
public class NomTamFitsContainer implements FitsContainer {

    private static final String PRIMARY = "PRIMARY";

    private final Fits fits;
    private final List<FitsHdu> hdus;

    private NomTamFitsContainer(Fits fits, List<FitsHdu> hdus) {
        this.fits = fits;
        this.hdus = Collections.unmodifiableList(hdus);
    }

    public static NomTamFitsContainer open(Path path) throws IOException {
        Fits fits;
        try {
            fits = new Fits(path.toFile());
        } catch (FitsException e) {
            throw new IOException("Cannot open FITS file " + path.getFileName() + ": " + e.getMessage(), e);
        }
        try {
            BasicHDU<?>[] read = fits.read();
            List<FitsHdu> views = new ArrayList<>();
            if (read != null) {
                for (int i = 0; i < read.length; i++) {
                    views.add(new HduView(read[i], i == 0));
                }
            }
            return new NomTamFitsContainer(fits, views);
        } catch (RuntimeException e) {
            fits.close();
            throw new IOException("Cannot read FITS file " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<FitsHdu> hdus() {
        return hdus;
    }

    @Override
    public void close() throws IOException {
        fits.close();
    }

    private static final class HduView implements FitsHdu {

        private final BasicHDU<?> hdu;
        private final String name;
        private final int version;
        private final List<String> columnNames;

        private HduView(BasicHDU<?> hdu, boolean primary) {
            this.hdu = hdu;
            Header header = hdu.getHeader();
            String extName = header.getStringValue("EXTNAME");
            this.name = extName != null ? extName.trim() : (primary ? PRIMARY : "");
            this.version = header.getIntValue("EXTVER", 1);
            this.columnNames = readColumnNames(hdu);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int version() {
            return version;
        }

        @Override
        public Optional<String> header(String key) {
            HeaderCard card = hdu.getHeader().findCard(key);
            if (card == null || card.getValue() == null) {
                return Optional.empty();
            }
            String value = card.getValue().trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        }

        @Override
        public boolean isTable() {
            return hdu instanceof BinaryTableHDU;
        }

        @Override
        public int rowCount() {
            return hdu instanceof BinaryTableHDU table ? table.getNRows() : 0;
        }

        @Override
        public List<String> columnNames() {
            return columnNames;
        }

        @Override
        public double[] column(String name) throws IOException {
            return ArrayConversions.flatten(rawColumn(name));
        }

        @Override
        public double[][] rows(String name) throws IOException {
            return ArrayConversions.toRows(rawColumn(name), rowCount());
        }

        private Object rawColumn(String name) throws IOException {
            if (!(hdu instanceof BinaryTableHDU table)) {
                throw new IOException("HDU " + this.name + " is not a binary table");
            }
            int index = indexOf(name);
            if (index < 0) {
                throw new IOException("Column " + name + " not found in " + this.name);
            }
            try {
                return table.getColumn(index);
            } catch (FitsException e) {
                throw new IOException("Cannot read column " + name + " of " + this.name + ": " + e.getMessage(), e);
            }
        }

        private int indexOf(String column) {
            for (int i = 0; i < columnNames.size(); i++) {
                if (columnNames.get(i).equalsIgnoreCase(column)) {
                    return i;
                }
            }
            return -1;
        }

        private static List<String> readColumnNames(BasicHDU<?> hdu) {
            if (!(hdu instanceof BinaryTableHDU table)) {
                return List.of();
            }
            List<String> names = new ArrayList<>(table.getNCols());
            for (int i = 0; i < table.getNCols(); i++) {
                String columnName = table.getColumnName(i);
                names.add(columnName == null ? "" : columnName.trim());
            }
            return Collections.unmodifiableList(names);
        }
    }
}
