package com.id.spectra.modules.jobs.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.spectra.modules.jobs.model.CustomBand;
import com.id.spectra.modules.jobs.model.JobOptions;
import com.id.spectra.modules.jobs.model.JobSubmission;
import com.id.spectra.modules.jobs.model.JobSubmitResponse;
import com.id.spectra.modules.jobs.model.JobView;
import com.id.spectra.modules.jobs.model.ResultLookup;
import com.id.spectra.modules.jobs.model.ValueRange;
import com.id.spectra.modules.jobs.model.ZAxisDisplay;
import com.id.spectra.modules.jobs.service.ExportService;
import com.id.spectra.modules.jobs.service.JobManager;
import com.id.spectra.modules.jobs.service.UploadStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("jobs")
public class JobsRest {

    private static final TypeReference<List<CustomBand>> BAND_LIST = new TypeReference<>() {
    };

    private final JobManager jobManager;
    private final UploadStorage uploadStorage;
    private final ExportService exportService;
    private final ObjectMapper objectMapper;

    public JobsRest(JobManager jobManager, UploadStorage uploadStorage, ExportService exportService, ObjectMapper objectMapper) {
        this.jobManager = jobManager;
        this.uploadStorage = uploadStorage;
        this.exportService = exportService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobSubmitResponse> submit(
            @RequestParam(value = "archive", required = false) MultipartFile archive,
            @RequestParam(value = "useDemo", defaultValue = "false") boolean useDemo,
            @RequestParam(value = "useInterpolation", defaultValue = "false") boolean useInterpolation,
            @RequestParam(value = "colorscale", defaultValue = "Viridis") String colorscale,
            @RequestParam(value = "numIntegrations", required = false) Integer numIntegrations,
            @RequestParam(value = "zAxisDisplay", required = false) String zAxisDisplay,
            @RequestParam(value = "timeRangeMin", required = false) Double timeRangeMin,
            @RequestParam(value = "timeRangeMax", required = false) Double timeRangeMax,
            @RequestParam(value = "wavelengthRangeMin", required = false) Double wavelengthRangeMin,
            @RequestParam(value = "wavelengthRangeMax", required = false) Double wavelengthRangeMax,
            @RequestParam(value = "variabilityRangeMin", required = false) Double variabilityRangeMin,
            @RequestParam(value = "variabilityRangeMax", required = false) Double variabilityRangeMax,
            @RequestParam(value = "customBands", required = false) String customBands) {

        Path input;
        if (useDemo) {
            input = uploadStorage.demoArchive()
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                            "Demo dataset not found. Please upload your own data."));
        } else {
            if (archive == null || archive.isEmpty()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No archive provided");
            }
            input = uploadStorage.store(archive);
        }

        JobOptions options = JobOptions.builder()
                .useInterpolation(useInterpolation)
                .colorscale(colorscale)
                .numIntegrations(numIntegrations)
                .displayMode(ZAxisDisplay.resolve(zAxisDisplay))
                .timeRange(ValueRange.of(timeRangeMin, timeRangeMax))
                .wavelengthRange(ValueRange.of(wavelengthRangeMin, wavelengthRangeMax))
                .variabilityRange(ValueRange.of(variabilityRangeMin, variabilityRangeMax))
                .customBands(parseBands(customBands))
                .useDemo(useDemo)
                .build();
        String jobId = jobManager.submit(new JobSubmission(input, useDemo, options));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new JobSubmitResponse(jobId));
    }

    @GetMapping("{jobId}/progress")
    public JobView getProgress(@PathVariable("jobId") String jobId) {
        return jobManager.poll(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId));
    }

    @GetMapping("{jobId}/result")
    public ResponseEntity<?> getResult(@PathVariable("jobId") String jobId) {
        ResultLookup lookup = jobManager.fetchResult(jobId);
        return switch (lookup.state()) {
            case NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId);
            case FAILED -> throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, lookup.message());
            case NOT_READY -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", lookup.message()));
            case READY -> ResponseEntity.ok(lookup.payload());
        };
    }

    @PostMapping("{jobId}/cancel")
    public JobView cancel(@PathVariable("jobId") String jobId) {
        return jobManager.cancel(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId));
    }

    @PostMapping("{jobId}/export")
    public Map<String, String> export(@PathVariable("jobId") String jobId) {
        ResultLookup lookup = jobManager.fetchResult(jobId);
        switch (lookup.state()) {
            case NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId);
            case NOT_READY, FAILED -> throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Job has no result to export: " + lookup.message());
            default -> {
            }
        }
        String token = exportService.exportPayload(lookup.payload())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Export failed"));
        return Map.of("token", token);
    }

    private List<CustomBand> parseBands(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(raw, BAND_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed custom bands: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }
}
