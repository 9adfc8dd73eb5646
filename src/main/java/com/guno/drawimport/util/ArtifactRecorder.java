package com.guno.drawimport.util;

import com.guno.drawimport.config.DrawSourceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Dumps raw upstream bodies of the last run for inspection, e.g.
 * {@code artifacts/last_fetch/bingo_2025-08-19_s3_p1.json}. Disabled by default; a failed dump
 * only logs, it never fails the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArtifactRecorder {

    private final DrawSourceProperties properties;

    public Optional<Path> recordApiPage(LocalDate date, int shapeOrdinal, int pageNumber, String body) {
        return record(String.format("bingo_%s_s%d_p%d.json", date, shapeOrdinal, pageNumber), body);
    }

    public Optional<Path> recordHtmlPage(LocalDate date, int urlIndex, int poll, String body) {
        return record(String.format("bingo_%s_html%d_poll%d.html", date, urlIndex, poll), body);
    }

    private Optional<Path> record(String fileName, String body) {
        if (!properties.getArtifacts().isEnabled() || body == null) {
            return Optional.empty();
        }

        Path target = Paths.get(properties.getArtifacts().getDirectory()).resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, body, StandardCharsets.UTF_8);
            log.trace("Artifact written: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("⚠️ Could not write artifact {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }
}
