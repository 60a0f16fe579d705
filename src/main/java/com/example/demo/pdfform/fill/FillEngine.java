package com.example.demo.pdfform.fill;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.FillException;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.FormTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes template values into a PDF.
 *
 * Strategies are tried in their declared order and the first success wins. If every
 * strategy fails, the last strategy's error is thrown with the earlier ones attached as
 * suppressed exceptions. Flattening is a separate pass over the filled file and writes
 * {@code <name>_flat.pdf} next to it.
 */
@Slf4j
@Component
public class FillEngine {
    private final List<FillStrategy> strategies;
    private final DocumentResolver documentResolver;

    public FillEngine(List<FillStrategy> strategies, DocumentResolver documentResolver) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one fill strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.documentResolver = documentResolver;
    }

    public FillResult fill(FormTemplate template, Path outputPath, Path outputDir, boolean flatten) {
        return fill(FillRequest.builder()
                .documentReference(template.getDocumentReference())
                .fields(template.getFields())
                .outputPath(outputPath)
                .outputDir(outputDir)
                .flatten(flatten)
                .build());
    }

    @LogExecutionTime("Filling Form")
    public FillResult fill(FillRequest request) {
        DocumentResolver.ResolvedDocument document = documentResolver.resolve(request.getDocumentReference());
        try {
            return fill(document, request);
        } finally {
            if (document.isFetched()) {
                DocumentResolver.deleteScratch(document.getPath());
            }
        }
    }

    private FillResult fill(DocumentResolver.ResolvedDocument document, FillRequest request) {
        Path filled = OutputPaths.resolve(request.getOutputPath(), request.getOutputDir(),
                document.getBaseName(), OutputPaths.FILLED_SUFFIX);
        try {
            OutputPaths.ensureParentDirectory(filled);
        } catch (IOException e) {
            throw new FillException(ErrorCode.IO_FAILURE, Stage.FILL_PDF,
                    "Cannot create output directory for " + filled + ": " + e.getMessage(), e);
        }

        Map<String, String> fields = request.getFields() == null ? Map.of() : request.getFields();
        List<Exception> failures = new ArrayList<>();
        FillStrategy used = null;
        for (FillStrategy strategy : strategies) {
            try {
                strategy.fill(document.getPath(), fields, filled);
                used = strategy;
                break;
            } catch (IOException | RuntimeException e) {
                log.warn("Fill strategy '{}' failed for {}: {}", strategy.name(), document.getPath(), e.getMessage());
                failures.add(e);
            }
        }
        if (used == null) {
            throw allStrategiesFailed(document.getPath(), failures);
        }
        String fallbackReason = failures.isEmpty() ? null : describe(failures);
        log.info("Filled {} fields into {} using '{}'", fields.size(), filled, used.name());

        Path output = filled;
        if (request.isFlatten()) {
            output = flatten(filled);
        }

        return FillResult.builder()
                .outputPath(output)
                .filledPath(filled)
                .inputDocument(document.getPath())
                .flattened(request.isFlatten())
                .strategy(used.name())
                .fallbackReason(fallbackReason)
                .build();
    }

    /**
     * Mark every field of {@code filled} read-only and save the result as its
     * {@code _flat.pdf} sibling. {@code filled} itself is left untouched, also on failure.
     */
    @LogExecutionTime("Flattening Form")
    public Path flatten(Path filled) {
        Path flat = OutputPaths.flattenedSibling(filled);
        try (PDDocument document = PDDocument.load(filled.toFile())) {
            PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
            if (acroForm == null) {
                throw new IOException("No AcroForm found in " + filled.getFileName());
            }
            int locked = 0;
            for (PDField field : acroForm.getFieldTree()) {
                field.setReadOnly(true);
                locked++;
            }
            document.save(flat.toFile());
            log.info("Locked {} fields into {}", locked, flat);
            return flat;
        } catch (IOException | RuntimeException e) {
            throw new FillException(ErrorCode.FLATTEN_FAILED, Stage.FLATTEN,
                    "Failed to flatten " + filled + " (filled document kept): " + e.getMessage(), e);
        }
    }

    public List<String> strategyNames() {
        List<String> names = new ArrayList<>();
        for (FillStrategy strategy : strategies) {
            names.add(strategy.name());
        }
        return names;
    }

    private PdfFormException allStrategiesFailed(Path document, List<Exception> failures) {
        Exception last = failures.get(failures.size() - 1);
        FillException exception = new FillException(ErrorCode.SECONDARY_FILL_FAILED, Stage.FILL_PDF,
                "All fill strategies failed for " + document + ", last error: " + last.getMessage(), last);
        for (Exception earlier : failures.subList(0, failures.size() - 1)) {
            exception.addSuppressed(earlier);
        }
        return exception;
    }

    private String describe(List<Exception> failures) {
        StringBuilder reason = new StringBuilder();
        for (int i = 0; i < failures.size(); i++) {
            if (reason.length() > 0) {
                reason.append("; ");
            }
            reason.append(strategies.get(i).name()).append(": ").append(failures.get(i).getMessage());
        }
        return reason.toString();
    }
}
