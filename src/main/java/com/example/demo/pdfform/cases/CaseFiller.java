package com.example.demo.pdfform.cases;

import com.example.demo.pdfform.fill.FillEngine;
import com.example.demo.pdfform.fill.FillRequest;
import com.example.demo.pdfform.fill.FillResult;
import com.example.demo.pdfform.model.FormCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Fills a document from a saved case.
 */
@Slf4j
@Component
public class CaseFiller {
    private final CaseStore caseStore;
    private final FillEngine fillEngine;

    public CaseFiller(CaseStore caseStore, FillEngine fillEngine) {
        this.caseStore = caseStore;
        this.fillEngine = fillEngine;
    }

    public FillResult fillFromCase(Path casePath, Path outputDir, boolean flatten) {
        FormCase formCase = caseStore.load(casePath);
        String documentReference = caseStore.resolveDocumentReference(formCase);
        log.info("Filling case {} from {}", formCase.getCaseMetadata().getCaseId(), documentReference);

        return fillEngine.fill(FillRequest.builder()
                .documentReference(documentReference)
                .fields(formCase.getFields())
                .outputDir(outputDir)
                .flatten(flatten)
                .build());
    }
}
