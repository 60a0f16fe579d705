package com.example.demo.pdfform.command;

import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.InspectEventData;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.ExtractionException;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.fill.OutputPaths;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.provenance.ProvenanceStore;
import com.example.demo.pdfform.template.FieldExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Lists a PDF's fillable fields and exports them as a {@code <name>_template.json}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InspectCommand {
    private final FieldExtractor fieldExtractor;
    private final ProvenanceStore provenanceStore;
    private final EventPublisher events;

    /**
     * @param output template file, or a directory to write {@code <name>_template.json} into;
     *               blank writes next to the working directory
     */
    public InspectResult inspect(Path pdfPath, String output) {
        Path templatePath = OutputPaths.resolveArgument(output, OutputPaths.baseName(pdfPath), OutputPaths.TEMPLATE_SUFFIX);
        return inspectTo(pdfPath, templatePath);
    }

    public InspectResult inspectInto(Path pdfPath, Path outputDir) {
        return inspectTo(pdfPath, OutputPaths.resolve(null, outputDir, OutputPaths.baseName(pdfPath), OutputPaths.TEMPLATE_SUFFIX));
    }

    public InspectResult inspectTo(Path pdfPath, Path templatePath) {
        InspectEventData data = InspectEventData.builder()
                .pdfPath(pdfPath.toString())
                .outputPath(templatePath.toString())
                .build();
        events.emit(EventType.INSPECT_STARTED, data);

        String stage = Stage.VALIDATE_INPUT;
        try {
            if (!Files.isRegularFile(pdfPath)) {
                throw new ExtractionException(ErrorCode.DOCUMENT_NOT_FOUND, Stage.VALIDATE_INPUT,
                        "PDF file not found: " + pdfPath);
            }

            stage = Stage.CREATE_DIR;
            try {
                OutputPaths.ensureParentDirectory(templatePath);
            } catch (IOException e) {
                throw new ExtractionException(ErrorCode.IO_FAILURE, Stage.CREATE_DIR,
                        "Failed to create output directory for " + templatePath + ": " + e.getMessage(), e);
            }

            stage = Stage.EXPORT_JSON;
            FormTemplate template = fieldExtractor.exportTemplate(pdfPath, templatePath);
            boolean provenanceUpdated = provenanceStore.markInspectedAdvisory(pdfPath);

            events.emit(EventType.INSPECT_COMPLETED, data.toBuilder()
                    .templatePath(templatePath.toString())
                    .fieldCount(template.getFields().size())
                    .build());
            return InspectResult.builder()
                    .pdfPath(pdfPath)
                    .templatePath(templatePath)
                    .fields(new ArrayList<>(template.getFields().keySet()))
                    .template(template)
                    .provenanceUpdated(provenanceUpdated)
                    .build();
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, stage);
            events.emitError(EventType.INSPECT_ERROR, failure, data.toBuilder().stage(failure.getStage()).build());
            throw failure;
        }
    }
}
