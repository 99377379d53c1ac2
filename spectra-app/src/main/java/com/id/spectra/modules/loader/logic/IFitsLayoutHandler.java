package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.model.FitsLayout;

import java.io.IOException;

public interface IFitsLayoutHandler {

    FitsLayout layout();

    void collect(FitsContainer container, double[] midTimes, IntegrationCollector collector) throws IOException;
}
