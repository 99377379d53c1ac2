package com.id.spectra.modules.loader.container;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public interface FitsContainer extends AutoCloseable {

    List<FitsHdu> hdus();

    default FitsHdu primary() {
        return hdus().get(0);
    }

    default Optional<FitsHdu> find(String name) {
        return findAll(name).stream().findFirst();
    }

    default Optional<FitsHdu> find(String name, int version) {
        return hdus().stream()
                .filter(hdu -> hdu.name().equalsIgnoreCase(name) && hdu.version() == version)
                .findFirst();
    }

    default List<FitsHdu> findAll(String name) {
        return hdus().stream()
                .filter(hdu -> hdu.name().equalsIgnoreCase(name))
                .sorted(Comparator.comparingInt(FitsHdu::version))
                .toList();
    }

    @Override
    void close() throws IOException;
}
