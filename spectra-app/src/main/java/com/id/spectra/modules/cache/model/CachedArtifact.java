package com.id.spectra.modules.cache.model;

import java.nio.file.Path;

public record CachedArtifact(String token, Path file, String downloadName) {
}
