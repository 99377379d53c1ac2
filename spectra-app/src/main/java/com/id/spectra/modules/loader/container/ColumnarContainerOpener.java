package com.id.spectra.modules.loader.container;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface ColumnarContainerOpener {

    ColumnarContainer open(Path path) throws IOException;
}
