package com.id.spectra.modules.loader.container;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
public class NomTamFitsOpener implements FitsContainerOpener {

    @Override
    public FitsContainer open(Path path) throws IOException {
        return NomTamFitsContainer.open(path);
    }
}
