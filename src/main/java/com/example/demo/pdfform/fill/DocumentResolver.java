package com.example.demo.pdfform.fill;

import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.FillException;
import com.example.demo.pdfform.exception.Stage;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Turns a template's document reference into a local file.
 *
 * http(s) URLs are fetched into a scratch file in the temp directory, which the fill
 * removes again when it is done; anything else must be an existing local file. There is no fallback between the two.
 */
@Slf4j
@Component
public class DocumentResolver {
    private final FormFetcher formFetcher;
    private final PdfFormProperties properties;

    public DocumentResolver(FormFetcher formFetcher, PdfFormProperties properties) {
        this.formFetcher = formFetcher;
        this.properties = properties;
    }

    public ResolvedDocument resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new FillException(ErrorCode.INVALID_DOCUMENT_REFERENCE, Stage.RESOLVE_DOCUMENT,
                    "A document reference is required");
        }
        String trimmed = reference.trim();
        if (isUrl(trimmed)) {
            return fetch(trimmed);
        }

        Path local;
        try {
            local = Paths.get(trimmed);
        } catch (InvalidPathException e) {
            throw new FillException(ErrorCode.INVALID_DOCUMENT_REFERENCE, Stage.RESOLVE_DOCUMENT,
                    "Document reference is neither a URL nor a valid path: " + reference, e);
        }
        if (!Files.isRegularFile(local)) {
            throw new FillException(ErrorCode.DOCUMENT_NOT_FOUND, Stage.RESOLVE_DOCUMENT,
                    "PDF file not found: " + local);
        }
        return new ResolvedDocument(local, OutputPaths.baseName(local), false);
    }

    private ResolvedDocument fetch(String url) {
        String baseName = OutputPaths.baseName(URI.create(url).getPath());
        if (baseName.isEmpty()) {
            baseName = "form_template";
        }
        Path scratch = null;
        try {
            Path tempDir = properties.tempPath();
            Files.createDirectories(tempDir);
            scratch = Files.createTempFile(tempDir, baseName + "-", ".pdf");
            formFetcher.fetch(url, scratch);
            log.info("Fetched remote document {} to {}", url, scratch);
            return new ResolvedDocument(scratch, baseName, true);
        } catch (IOException e) {
            if (scratch != null) {
                deleteScratch(scratch);
            }
            throw new FillException(ErrorCode.DOCUMENT_NOT_FOUND, Stage.RESOLVE_DOCUMENT,
                    "Failed to fetch document " + url + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (scratch != null) {
                deleteScratch(scratch);
            }
            throw e;
        }
    }

    /**
     * Remove a fetched copy once the fill that needed it is over.
     */
    static void deleteScratch(Path scratch) {
        try {
            Files.deleteIfExists(scratch);
        } catch (IOException e) {
            log.warn("Could not delete fetched document {}: {}", scratch, e.getMessage());
        }
    }

    public static boolean isUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && ("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Value
    public static class ResolvedDocument {
        Path path;
        /**
         * File name without extension, used to name outputs
         */
        String baseName;
        boolean fetched;
    }
}
