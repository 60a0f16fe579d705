package com.example.demo.pdfform.command;

import com.example.demo.pdfform.cases.CaseStore;
import com.example.demo.pdfform.event.CaseEventData;
import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.FormCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Case operations with {@code case.*} events.
 *
 * Every call emits {@code case.started}, then {@code case.created}, {@code case.loaded},
 * {@code case.updated} or {@code case.error}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseCommand {
    private final CaseStore caseStore;
    private final EventPublisher events;

    public CaseStore.CreatedCase create(String formCode, String caseName, String entityName) {
        CaseEventData data = CaseEventData.builder()
                .formCode(formCode)
                .entityName(entityName)
                .build();
        return run(data, Stage.CREATE, EventType.CASE_CREATED,
                () -> caseStore.create(formCode, caseName, entityName),
                created -> describe(data, created.getFormCase(), created.getPath()));
    }

    public FormCase load(Path casePath) {
        CaseEventData data = CaseEventData.builder().casePath(casePath.toString()).build();
        return run(data, Stage.LOAD, EventType.CASE_LOADED,
                () -> caseStore.load(casePath),
                formCase -> describe(data, formCase, casePath));
    }

    public FormCase save(FormCase formCase, Path casePath) {
        CaseEventData data = describe(CaseEventData.builder().build(), formCase, casePath);
        return run(data, Stage.SAVE, EventType.CASE_UPDATED,
                () -> {
                    caseStore.save(formCase, casePath);
                    return formCase;
                },
                saved -> data);
    }

    /**
     * Merge {@code fields} into the stored case and save it. Existing values are overwritten.
     */
    public FormCase updateFields(Path casePath, Map<String, String> fields) {
        CaseEventData data = CaseEventData.builder().casePath(casePath.toString()).build();
        return run(data, Stage.SAVE, EventType.CASE_UPDATED,
                () -> {
                    FormCase formCase = caseStore.load(casePath);
                    formCase.getFields().putAll(fields);
                    caseStore.save(formCase, casePath);
                    return formCase;
                },
                saved -> describe(data, saved, casePath));
    }

    /**
     * Case files of {@code entityName}, or of every entity when it is blank.
     */
    public List<Path> list(String entityName) {
        CaseEventData data = CaseEventData.builder().entityName(entityName).build();
        return run(data, Stage.LIST, EventType.CASE_LOADED,
                () -> caseStore.list(entityName),
                paths -> data.toBuilder().caseCount(paths.size()).stage(Stage.LIST).build());
    }

    public Path findById(String caseId) {
        CaseEventData data = CaseEventData.builder().caseId(caseId).build();
        return run(data, Stage.LOAD, EventType.CASE_LOADED,
                () -> caseStore.findById(caseId),
                path -> data.toBuilder().casePath(path.toString()).build());
    }

    /**
     * Validate a stored case against its template. The result is written back only when
     * {@code persist} is set.
     */
    public FormCase validate(Path casePath, boolean persist) {
        CaseEventData data = CaseEventData.builder().casePath(casePath.toString()).build();
        return run(data, Stage.VALIDATE, EventType.CASE_UPDATED,
                () -> {
                    FormCase formCase = caseStore.load(casePath);
                    caseStore.validate(formCase);
                    if (persist) {
                        caseStore.save(formCase, casePath);
                    }
                    return formCase;
                },
                validated -> describe(data, validated, casePath).toBuilder()
                        .valid(validated.getValidation().isValid())
                        .missingFields(new ArrayList<>(validated.getValidation().getMissingFields()))
                        .stage(Stage.VALIDATE)
                        .build());
    }

    private <T> T run(CaseEventData data, String stage, EventType success,
                      Supplier<T> operation, Function<T, CaseEventData> completed) {
        events.emit(EventType.CASE_STARTED, data.toBuilder().stage(stage).build());
        try {
            T result = operation.get();
            events.emit(success, completed.apply(result));
            return result;
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, stage);
            events.emitError(EventType.CASE_ERROR, failure, data.toBuilder().stage(failure.getStage()).build());
            throw failure;
        }
    }

    private static CaseEventData describe(CaseEventData base, FormCase formCase, Path casePath) {
        FormCase.CaseMetadata metadata = formCase.getCaseMetadata();
        return base.toBuilder()
                .caseId(metadata.getCaseId())
                .entityName(metadata.getEntityName())
                .formCode(formCase.getFormReference() == null ? null : formCase.getFormReference().getFormCode())
                .casePath(casePath.toString())
                .fieldCount(formCase.getFields().size())
                .build();
    }
}
