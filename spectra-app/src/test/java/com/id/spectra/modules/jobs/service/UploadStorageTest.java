package com.id.spectra.modules.jobs.service;

import com.id.spectra.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadStorageTest {

    @TempDir
    Path tempDir;

    @Mock
    private AppConfig appConfig;

    @Test
    void storesUploadKeepingSpectralExtension() throws Exception {
        when(appConfig.getJobsWorkDir()).thenReturn(tempDir.resolve("work").toString());
        UploadStorage storage = new UploadStorage(appConfig);

        Path stored = storage.store(new MockMultipartFile("archive", "jw01366.FITS", "application/fits", new byte[]{1, 2, 3}));

        assertTrue(stored.getFileName().toString().endsWith(".fits"));
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(stored));
        assertEquals(tempDir.resolve("work"), stored.getParent());
    }

    @Test
    void otherUploadsAreTreatedAsZip() {
        when(appConfig.getJobsWorkDir()).thenReturn(tempDir.toString());

        Path stored = new UploadStorage(appConfig).store(new MockMultipartFile("archive", "batch.bin", null, new byte[]{9}));

        assertTrue(stored.getFileName().toString().endsWith(".zip"));
    }

    @Test
    void jobDirectoriesAreCreatedUnderWorkDir() {
        when(appConfig.getJobsWorkDir()).thenReturn(tempDir.toString());

        Path dir = new UploadStorage(appConfig).createJobDir("abcdef0123456789");

        assertTrue(Files.isDirectory(dir));
        assertTrue(dir.getFileName().toString().startsWith("job_abcdef01_"));
    }

    @Test
    void demoArchiveOnlyWhenConfiguredAndPresent() throws Exception {
        UploadStorage storage = new UploadStorage(appConfig);
        when(appConfig.getDemoArchive()).thenReturn("", tempDir.resolve("missing.zip").toString(),
                Files.writeString(tempDir.resolve("demo.zip"), "demo").toString());

        assertTrue(storage.demoArchive().isEmpty());
        assertTrue(storage.demoArchive().isEmpty());
        assertEquals(tempDir.resolve("demo.zip"), storage.demoArchive().orElseThrow());
    }
}
