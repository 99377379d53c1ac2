package com.id.spectra.modules.visits.model;

public record Visit(int start, int end) {

    public int length() {
        return end - start;
    }
}
