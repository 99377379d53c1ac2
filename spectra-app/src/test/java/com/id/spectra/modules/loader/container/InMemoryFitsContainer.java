package com.id.spectra.modules.loader.container;

import java.util.ArrayList;
import java.util.List;

public class InMemoryFitsContainer implements FitsContainer {

    private final List<FitsHdu> hdus = new ArrayList<>();
    private boolean closed;

    public InMemoryFitsContainer(FitsHdu... hdus) {
        this.hdus.addAll(List.of(hdus));
    }

    @Override
    public List<FitsHdu> hdus() {
        return hdus;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
