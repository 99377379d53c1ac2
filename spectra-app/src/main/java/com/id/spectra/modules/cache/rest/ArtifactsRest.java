package com.id.spectra.modules.cache.rest;

import com.id.spectra.modules.cache.model.CachedArtifact;
import com.id.spectra.modules.cache.service.DatasetCache;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("artifacts")
public class ArtifactsRest {

    private final DatasetCache datasetCache;

    public ArtifactsRest(DatasetCache datasetCache) {
        this.datasetCache = datasetCache;
    }

    @GetMapping("{token}")
    public ResponseEntity<Resource> download(@PathVariable("token") String token) {
        CachedArtifact artifact = datasetCache.getArtifact(token)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Artifact not found or expired: " + token));
        MediaType contentType = MediaTypeFactory.getMediaType(artifact.downloadName())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.downloadName()).build().toString())
                .body(new FileSystemResource(artifact.file()));
    }
}
