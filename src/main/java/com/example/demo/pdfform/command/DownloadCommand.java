package com.example.demo.pdfform.command;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import com.example.demo.pdfform.catalog.CatalogLoader;
import com.example.demo.pdfform.catalog.FormsCatalog;
import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.event.DownloadEventData;
import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.exception.DownloadException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.fill.FormFetcher;
import com.example.demo.pdfform.model.CatalogEntry;
import com.example.demo.pdfform.provenance.ProvenanceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fetches a catalog form into a directory and records its provenance.
 *
 * Progress is reported at fixed checkpoints: form resolved (0.2), fetch started (0.4),
 * metadata saved (0.8) and done (1.0). A provenance write failure only adds a warning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadCommand {
    private final CatalogLoader catalogLoader;
    private final FormFetcher formFetcher;
    private final ProvenanceStore provenanceStore;
    private final EventPublisher events;
    private final PdfFormProperties properties;

    @LogExecutionTime("Downloading Form")
    public DownloadResult download(String formCode, Path destinationDir) {
        Path catalogPath = properties.catalogFilePath();
        return run(() -> catalogLoader.load(catalogPath), formCode, destinationDir);
    }

    @LogExecutionTime("Downloading Form")
    public DownloadResult download(FormsCatalog catalog, String formCode, Path destinationDir) {
        return run(() -> catalog, formCode, destinationDir);
    }

    private DownloadResult run(Supplier<FormsCatalog> catalogSource, String formCode, Path destinationDir) {
        DownloadEventData data = DownloadEventData.builder()
                .formCode(formCode)
                .outputDir(destinationDir.toString())
                .build();
        events.emit(EventType.DOWNLOAD_STARTED, data);

        String stage = Stage.LOAD_CATALOG;
        try {
            FormsCatalog catalog = catalogSource.get();

            stage = Stage.FIND_FORM;
            CatalogEntry form = catalog.byCode(formCode).orElseThrow(() -> new DownloadException(
                    ErrorCode.NOT_FOUND, Stage.FIND_FORM, "Form not found: " + formCode));
            data = data.toBuilder()
                    .formName(form.getFormName())
                    .region(form.getRegion())
                    .build();
            events.emit(EventType.DOWNLOAD_PROGRESS, data.toBuilder()
                    .stage(Stage.FOUND_FORM).progress(0.2).build());

            stage = Stage.CHECK_URL;
            if (!form.hasSource()) {
                throw new DownloadException(ErrorCode.NO_SOURCE, Stage.CHECK_URL,
                        "No direct download URL available for " + form.getFormCode());
            }

            stage = Stage.CREATE_DIR;
            try {
                Files.createDirectories(destinationDir);
            } catch (IOException e) {
                throw new DownloadException(ErrorCode.IO_FAILURE, Stage.CREATE_DIR,
                        "Failed to create output directory " + destinationDir + ": " + e.getMessage(), e);
            }

            stage = Stage.DOWNLOAD_PDF;
            Path pdfPath = destinationDir.resolve(fileName(form));
            data = data.toBuilder().pdfPath(pdfPath.toString()).build();
            events.emit(EventType.DOWNLOAD_PROGRESS, data.toBuilder()
                    .stage(Stage.DOWNLOADING).progress(0.4).build());
            try {
                formFetcher.fetch(form.getSourceUrl(), pdfPath);
            } catch (IOException e) {
                throw new DownloadException(ErrorCode.FETCH_FAILED, Stage.DOWNLOAD_PDF,
                        "Failed to download " + form.getSourceUrl() + ": " + e.getMessage(), e);
            }

            // the PDF is on disk, from here on nothing fails the download
            DownloadResult.DownloadResultBuilder result = DownloadResult.builder()
                    .pdfPath(pdfPath)
                    .form(form);
            Optional<Path> metadata = provenanceStore.recordDownloadAdvisory(
                    pdfPath, form.getFormCode(), form.getRegion(), form.getSourceUrl());
            DownloadEventData.DownloadEventDataBuilder saved = data.toBuilder()
                    .stage(Stage.SAVE_METADATA).progress(0.8);
            if (metadata.isPresent()) {
                result.metadataPath(metadata.get());
                saved.metadataPath(metadata.get().toString());
                data = data.toBuilder().metadataPath(metadata.get().toString()).build();
            } else {
                String warning = ErrorCode.METADATA_WRITE_FAILED + ": provenance metadata not saved for " + pdfPath;
                result.warning(warning);
                saved.warning(warning);
                data = data.toBuilder().warning(warning).build();
            }
            events.emit(EventType.DOWNLOAD_PROGRESS, saved.build());

            events.emit(EventType.DOWNLOAD_COMPLETED, data.toBuilder()
                    .stage(Stage.COMPLETE).progress(1.0).build());
            log.info("Downloaded {} to {}", form.getFormCode(), pdfPath);
            return result.build();
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, stage);
            events.emitError(EventType.DOWNLOAD_ERROR, failure, data.toBuilder().stage(failure.getStage()).build());
            throw failure;
        }
    }

    /**
     * Lower-cased form code plus {@code .pdf}; the form name with underscores when there is no code.
     */
    public static String fileName(CatalogEntry form) {
        String code = form.getFormCode();
        if (code != null && !code.isBlank()) {
            return code.trim().toLowerCase(Locale.ROOT) + ".pdf";
        }
        return form.getFormName().trim().replaceAll("\\s+", "_") + ".pdf";
    }
}
