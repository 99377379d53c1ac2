package com.id.spectra.modules.loader.model;

import com.id.spectra.model.HeaderInfo;
import com.id.spectra.model.Integration;

import java.util.List;

public record LoadedFile(List<Integration> integrations, HeaderInfo headerInfo) {
}
