package com.example.demo.pdfform.fill;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDCheckBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDChoice;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDRadioButton;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Primary strategy: PDFBox's high-level field API, which also regenerates widget
 * appearances.
 *
 * Strict: an unknown field name or any field that refuses its value fails the whole
 * fill and leaves the document to the next strategy.
 */
@Slf4j
@Order(1)
@Component
public class AcroFormFillStrategy implements FillStrategy {
    public static final String NAME = "acroform";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void fill(Path source, Map<String, String> fields, Path target) throws IOException {
        try (PDDocument document = PDDocument.load(source.toFile())) {
            PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
            if (acroForm == null) {
                throw new IOException("No AcroForm found in " + source.getFileName());
            }

            for (Map.Entry<String, String> entry : fields.entrySet()) {
                String fieldName = entry.getKey();
                String value = entry.getValue() == null ? "" : entry.getValue();

                PDField field = acroForm.getField(fieldName);
                if (field == null) {
                    throw new IOException("Field not found in form: " + fieldName);
                }
                setValue(field, value);
                log.debug("Set field '{}' = '{}'", fieldName, value);
            }

            document.save(target.toFile());
        }
    }

    private void setValue(PDField field, String value) throws IOException {
        if (field instanceof PDCheckBox) {
            PDCheckBox checkBox = (PDCheckBox) field;
            if (FieldValues.isChecked(value, checkBox.getOnValue())) {
                checkBox.check();
            } else {
                checkBox.unCheck();
            }
        } else if (field instanceof PDRadioButton) {
            ((PDRadioButton) field).setValue(value.isEmpty() ? "Off" : value);
        } else if (field instanceof PDChoice) {
            if (!value.isEmpty()) {
                ((PDChoice) field).setValue(value);
            }
        } else {
            field.setValue(value);
        }
    }
}
