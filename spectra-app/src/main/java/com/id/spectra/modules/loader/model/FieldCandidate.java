package com.id.spectra.modules.loader.model;

import java.util.function.DoubleUnaryOperator;

public record FieldCandidate(String name, DoubleUnaryOperator transform) {

    public static FieldCandidate of(String name) {
        return new FieldCandidate(name, DoubleUnaryOperator.identity());
    }

    public static FieldCandidate of(String name, DoubleUnaryOperator transform) {
        return new FieldCandidate(name, transform);
    }
}
