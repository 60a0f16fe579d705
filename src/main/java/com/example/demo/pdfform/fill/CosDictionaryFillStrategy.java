package com.example.demo.pdfform.fill;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceDictionary;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceEntry;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDButton;
import org.apache.pdfbox.pdmodel.interactive.form.PDCheckBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Fallback strategy: writes {@code /V} (and {@code /AS} for buttons) straight into the
 * field dictionaries and asks viewers to rebuild appearances via {@code NeedAppearances}.
 *
 * Skips the appearance generation that makes the primary strategy choke on fields
 * without a usable default appearance or font. Names the document does not declare
 * are logged and skipped; no field is ever created.
 */
@Slf4j
@Order(2)
@Component
public class CosDictionaryFillStrategy implements FillStrategy {
    public static final String NAME = "cos-dictionary";

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

            int written = 0;
            for (Map.Entry<String, String> entry : fields.entrySet()) {
                String fieldName = entry.getKey();
                String value = entry.getValue() == null ? "" : entry.getValue();

                PDField field = acroForm.getField(fieldName);
                if (!(field instanceof PDTerminalField)) {
                    log.warn("Field not found in form, skipping: {}", fieldName);
                    continue;
                }
                if (field instanceof PDButton) {
                    writeButtonState((PDButton) field, value);
                } else {
                    field.getCOSObject().setString(COSName.V, value);
                }
                written++;
            }

            acroForm.setNeedAppearances(true);
            document.save(target.toFile());
            log.debug("Wrote {} of {} values directly into field dictionaries", written, fields.size());
        }
    }

    private void writeButtonState(PDButton button, String value) {
        COSName state = COSName.Off;
        if (button instanceof PDCheckBox) {
            String onValue = ((PDCheckBox) button).getOnValue();
            if (FieldValues.isChecked(value, onValue)) {
                state = COSName.getPDFName(onValue);
            }
        } else if (button.getOnValues().contains(value)) {
            state = COSName.getPDFName(value);
        }

        button.getCOSObject().setItem(COSName.V, state);
        for (PDAnnotationWidget widget : button.getWidgets()) {
            widget.getCOSObject().setItem(COSName.AS, hasAppearance(widget, state) ? state : COSName.Off);
        }
    }

    private boolean hasAppearance(PDAnnotationWidget widget, COSName state) {
        PDAppearanceDictionary appearance = widget.getAppearance();
        if (appearance == null) {
            return false;
        }
        PDAppearanceEntry normal = appearance.getNormalAppearance();
        return normal != null && normal.isSubDictionary() && normal.getSubDictionary().containsKey(state);
    }
}
