package com.id.spectra.modules.loader.container;

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;

import java.io.IOException;
import java.nio.file.Path;

public class JhdfColumnarContainer implements ColumnarContainer {

    private final HdfFile hdfFile;

    private JhdfColumnarContainer(HdfFile hdfFile) {
        this.hdfFile = hdfFile;
    }

    public static JhdfColumnarContainer open(Path path) throws IOException {
        try {
            return new JhdfColumnarContainer(new HdfFile(path));
        } catch (RuntimeException e) {
            throw new IOException("Cannot open HDF5 file " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean has(String name) {
        return dataset(name) != null;
    }

    @Override
    public int[] shape(String name) {
        Dataset dataset = dataset(name);
        return dataset == null ? new int[0] : dataset.getDimensions();
    }

    @Override
    public Object read(String name) throws IOException {
        Dataset dataset = dataset(name);
        if (dataset == null) {
            throw new IOException("Dataset " + name + " not found");
        }
        try {
            return dataset.getData();
        } catch (RuntimeException e) {
            throw new IOException("Cannot read dataset " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        hdfFile.close();
    }

    private Dataset dataset(String name) {
        Node node = hdfFile.getChildren().get(name);
        return node instanceof Dataset dataset ? dataset : null;
    }
}
