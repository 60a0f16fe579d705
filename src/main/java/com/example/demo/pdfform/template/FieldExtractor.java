package com.example.demo.pdfform.template;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.ExtractionException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.model.Provenance;
import com.example.demo.pdfform.provenance.ProvenanceStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDPushButton;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers the fillable fields of a PDF and turns them into a {@link FormTemplate}.
 *
 * Fillable means terminal AcroForm fields other than push buttons and signature
 * fields. Names are fully qualified and returned exactly as stored in the document,
 * in the order of the field tree. {@link #exportTemplate} uses the same listing, so
 * the template's keys always equal {@link #listFields} for the same document.
 */
@Slf4j
@Component
public class FieldExtractor {
    private final ProvenanceStore provenanceStore;
    private final TemplateStore templateStore;

    public FieldExtractor(ProvenanceStore provenanceStore, TemplateStore templateStore) {
        this.provenanceStore = provenanceStore;
        this.templateStore = templateStore;
    }

    @LogExecutionTime("Listing Form Fields")
    public List<String> listFields(Path document) {
        try (PDDocument pdf = PDDocument.load(document.toFile())) {
            return fieldNames(pdf);
        } catch (IOException e) {
            throw new ExtractionException(ErrorCode.LIST_FIELDS_FAILED, Stage.LIST_FIELDS,
                    "Failed to extract form fields from " + document + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write a template for {@code document} to {@code destination}. Every value is empty;
     * an existing provenance sidecar is copied in, a missing one is not an error.
     */
    @LogExecutionTime("Exporting Field Template")
    public FormTemplate exportTemplate(Path document, Path destination) {
        List<String> names = listFields(document);

        Map<String, String> fields = new LinkedHashMap<>();
        for (String name : names) {
            fields.put(name, "");
        }
        Provenance provenance = provenanceStore.readAdvisory(document).orElse(null);

        FormTemplate template = FormTemplate.builder()
                .documentReference(document.toString())
                .provenance(provenance)
                .fields(fields)
                .build();
        try {
            templateStore.write(destination, template);
        } catch (IOException e) {
            throw new ExtractionException(ErrorCode.EXPORT_FAILED, Stage.EXPORT_JSON,
                    "Failed to write template " + destination + ": " + e.getMessage(), e);
        }
        log.info("Exported {} fields of {} to {}", fields.size(), document.getFileName(), destination);
        return template;
    }

    static List<String> fieldNames(PDDocument pdf) {
        PDAcroForm acroForm = pdf.getDocumentCatalog().getAcroForm();
        if (acroForm == null) {
            log.warn("Document has no AcroForm, no fillable fields");
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (PDField field : acroForm.getFieldTree()) {
            if (isFillable(field)) {
                names.add(field.getFullyQualifiedName());
            }
        }
        return new ArrayList<>(names);
    }

    static boolean isFillable(PDField field) {
        return field instanceof PDTerminalField
                && !(field instanceof PDPushButton)
                && !(field instanceof PDSignatureField);
    }
}
