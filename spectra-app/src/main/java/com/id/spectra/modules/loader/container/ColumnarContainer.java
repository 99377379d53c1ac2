package com.id.spectra.modules.loader.container;

import java.io.IOException;

public interface ColumnarContainer extends AutoCloseable {

    boolean has(String name);

    int[] shape(String name);

    Object read(String name) throws IOException;

    @Override
    void close() throws IOException;
}
