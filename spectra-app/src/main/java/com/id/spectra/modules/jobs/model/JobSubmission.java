package com.id.spectra.modules.jobs.model;

import java.nio.file.Path;

public record JobSubmission(Path archive, boolean demo, JobOptions options) {
}
