package com.id.spectra.modules.jobs.logic;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Unpacks an uploaded batch and lists the spectral files it holds.
 */
@Slf4j
@Component
public class ArchiveExtractor {

    /**
     * @param archive   - zip archive, or a single .fits/.h5 file used as is
     * @param targetDir - directory receiving the extracted entries
     * @return spectral files found, in path order
     */
    public List<Path> extract(Path archive, Path targetDir) throws IOException {
        if (isSpectralFile(archive)) {
            return List.of(archive);
        }
        Files.createDirectories(targetDir);
        Path root = targetDir.toAbsolutePath().normalize();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }

        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                    .filter(ArchiveExtractor::isSpectralFile)
                    .sorted()
                    .forEach(files::add);
        }
        log.info("Extracted {} spectral files from {}", files.size(), archive.getFileName());
        return files;
    }

    public static boolean isSpectralFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".fits") || name.endsWith(".h5");
    }
}
