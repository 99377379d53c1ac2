package com.id.spectra.modules.loader.container;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface FitsContainerOpener {

    FitsContainer open(Path path) throws IOException;
}
