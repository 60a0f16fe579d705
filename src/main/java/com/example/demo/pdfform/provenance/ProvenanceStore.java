package com.example.demo.pdfform.provenance;

import com.example.demo.pdfform.model.Provenance;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Reads and writes the provenance sidecar ({@code <document>.meta.json}).
 *
 * The plain methods throw; the {@code *Advisory} variants are for callers whose
 * primary artifact is already on disk and log the failure instead.
 */
@Slf4j
@Component
public class ProvenanceStore {
    public static final String SIDECAR_SUFFIX = ".meta.json";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ProvenanceStore(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public ProvenanceStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static Path sidecarPath(Path document) {
        return document.resolveSibling(document.getFileName().toString() + SIDECAR_SUFFIX);
    }

    public Path write(Path document, Provenance provenance) throws IOException {
        Path sidecar = sidecarPath(document);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(sidecar.toFile(), provenance);
        return sidecar;
    }

    /**
     * @return the sidecar contents, or empty when the document has no sidecar
     */
    public Optional<Provenance> read(Path document) throws IOException {
        Path sidecar = sidecarPath(document);
        try {
            return Optional.of(objectMapper.readValue(Files.readAllBytes(sidecar), Provenance.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * Like {@link #read(Path)} but a malformed or unreadable sidecar is logged and treated as absent.
     */
    public Optional<Provenance> readAdvisory(Path document) {
        try {
            return read(document);
        } catch (IOException e) {
            log.warn("Ignoring unreadable provenance sidecar for {}: {}", document, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Record where a freshly downloaded document came from.
     *
     * @return the sidecar path, or empty if it could not be written
     */
    public Optional<Path> recordDownloadAdvisory(Path document, String formCode, String region, String sourceUrl) {
        Provenance provenance = Provenance.builder()
                .originFormCode(formCode)
                .originRegion(region)
                .sourceUrl(sourceUrl)
                .downloadedAt(clock.instant())
                .build();
        try {
            return Optional.of(write(document, provenance));
        } catch (IOException e) {
            log.warn("Could not save provenance metadata for {}: {}", document, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stamp {@code inspected_at} on an existing sidecar.
     *
     * @return true when a sidecar existed and was updated
     */
    public boolean markInspectedAdvisory(Path document) {
        try {
            Optional<Provenance> existing = read(document);
            if (existing.isEmpty()) {
                log.debug("No provenance sidecar for {}, skipping inspected timestamp", document);
                return false;
            }
            Provenance provenance = existing.get();
            provenance.setInspectedAt(clock.instant());
            write(document, provenance);
            return true;
        } catch (IOException e) {
            log.warn("Could not update inspected timestamp for {}: {}", document, e.getMessage());
            return false;
        }
    }
}
