package com.example.demo.pdfform.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Filesystem layout and runtime settings for the form service.
 *
 * All paths are resolved against {@code dataDir}. An instance of this class is
 * handed to every component that touches the filesystem; nothing reads a
 * process-wide default.
 *
 * Example application.yml:
 *
 * pdfform:
 *   data-dir: ${PDFFORM_DATA_DIR:.data}
 *   catalog-file: australian_transfer_forms.csv
 *   event-buffer-size: 100
 *   command-threads: 4
 *   event-stream-threads: 16
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "pdfform")
public class PdfFormProperties {
    public static final String TEST_SCENARIOS_DIR = "test_scenarios";

    /**
     * Base directory, all other directories are relative to it
     */
    private String dataDir = ".data";

    private String catalogDir = "catalog";

    private String catalogFile = "australian_transfer_forms.csv";

    private String downloadsDir = "downloads";

    private String templatesDir = "templates";

    private String outputsDir = "outputs";

    private String casesDir = "cases";

    private String tempDir = "temp";

    /**
     * Per-subscriber buffer of the event bus. Events published to a full buffer are dropped.
     */
    private int eventBufferSize = 100;

    /**
     * Worker threads used for background workflow runs
     */
    private int commandThreads = 4;

    /**
     * Upper bound on concurrently open server-sent event streams, one thread each
     */
    private int eventStreamThreads = 16;

    /**
     * Connect and read timeout for remote form downloads
     */
    private Duration fetchTimeout = Duration.ofSeconds(30);

    public static PdfFormProperties forDataDir(Path dataDir) {
        PdfFormProperties properties = new PdfFormProperties();
        properties.setDataDir(dataDir.toString());
        return properties;
    }

    public Path dataPath() {
        return Paths.get(dataDir);
    }

    public Path catalogPath() {
        return dataPath().resolve(catalogDir);
    }

    public Path catalogFilePath() {
        return catalogPath().resolve(catalogFile);
    }

    public Path downloadsPath() {
        return dataPath().resolve(downloadsDir);
    }

    public Path templatesPath() {
        return dataPath().resolve(templatesDir);
    }

    public Path outputsPath() {
        return dataPath().resolve(outputsDir);
    }

    public Path casesPath() {
        return dataPath().resolve(casesDir);
    }

    public Path entityCasesPath(String entityName) {
        return casesPath().resolve(entityName);
    }

    public Path testScenariosPath() {
        return casesPath().resolve(TEST_SCENARIOS_DIR);
    }

    public Path tempPath() {
        return dataPath().resolve(tempDir);
    }

    /**
     * Create every directory of the layout. Existing directories are left alone.
     */
    public void ensureDirectories() throws IOException {
        for (Path dir : List.of(catalogPath(), downloadsPath(), templatesPath(), outputsPath(),
                casesPath(), tempPath(), testScenariosPath())) {
            Files.createDirectories(dir);
        }
    }
}
