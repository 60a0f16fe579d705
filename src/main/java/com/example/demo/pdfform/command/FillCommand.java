package com.example.demo.pdfform.command;

import com.example.demo.pdfform.cases.CaseFiller;
import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.FillEventData;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.FillException;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.fill.FillEngine;
import com.example.demo.pdfform.fill.FillResult;
import com.example.demo.pdfform.fill.OutputPaths;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.template.TemplateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Fills a PDF from a template file, an in-memory template or a saved case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FillCommand {
    private final FillEngine fillEngine;
    private final TemplateStore templateStore;
    private final CaseFiller caseFiller;
    private final EventPublisher events;

    /**
     * @param output output file, or a directory for {@code <name>_filled.pdf}; blank uses the working directory
     */
    public FillResult fill(Path templatePath, String output, boolean flatten) {
        boolean hasOutput = output != null && !output.isBlank();
        boolean toDirectory = hasOutput && OutputPaths.isDirectoryArgument(output);
        Path outputPath = hasOutput && !toDirectory ? Paths.get(output) : null;
        Path outputDir = toDirectory ? Paths.get(output) : null;
        FillEventData data = FillEventData.builder()
                .templatePath(templatePath.toString())
                .outputPath(output)
                .build();
        return run(data, () -> {
            FormTemplate template = readTemplate(templatePath);
            return fillEngine.fill(template, outputPath, outputDir, flatten);
        });
    }

    public FillResult fill(FormTemplate template, Path outputPath, Path outputDir, boolean flatten) {
        FillEventData data = FillEventData.builder()
                .inputPdf(template.getDocumentReference())
                .outputPath(outputPath == null ? null : outputPath.toString())
                .build();
        return run(data, () -> fillEngine.fill(template, outputPath, outputDir, flatten));
    }

    public FillResult fillFromCase(Path casePath, Path outputDir, boolean flatten) {
        FillEventData data = FillEventData.builder()
                .casePath(casePath.toString())
                .outputPath(outputDir == null ? null : outputDir.toString())
                .build();
        return run(data, () -> caseFiller.fillFromCase(casePath, outputDir, flatten));
    }

    private FillResult run(FillEventData data, Supplier<FillResult> fill) {
        events.emit(EventType.FILL_STARTED, data);
        try {
            FillResult result = fill.get();
            events.emit(EventType.FILL_COMPLETED, data.toBuilder()
                    .inputPdf(result.getInputDocument().toString())
                    .filledPath(result.getFilledPath().toString())
                    .outputPath(result.getOutputPath().toString())
                    .flattened(result.isFlattened())
                    .strategy(result.getStrategy())
                    .fallbackReason(result.getFallbackReason())
                    .build());
            return result;
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, Stage.FILL_PDF);
            events.emitError(EventType.FILL_ERROR, failure, data.toBuilder().stage(failure.getStage()).build());
            throw failure;
        }
    }

    private FormTemplate readTemplate(Path templatePath) {
        try {
            return templateStore.read(templatePath);
        } catch (NoSuchFileException e) {
            throw new FillException(ErrorCode.NOT_FOUND, Stage.LOAD_TEMPLATE, "Template not found: " + templatePath, e);
        } catch (IOException e) {
            throw new FillException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_TEMPLATE,
                    "Failed to read template " + templatePath + ": " + e.getMessage(), e);
        }
    }
}
