package com.id.spectra.modules.loader.container;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
public class JhdfColumnarOpener implements ColumnarContainerOpener {

    @Override
    public ColumnarContainer open(Path path) throws IOException {
        return JhdfColumnarContainer.open(path);
    }
}
