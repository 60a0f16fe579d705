package com.example.demo.pdfform.cases;

import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.CaseException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.FormCase;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.template.TemplateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed case persistence.
 *
 * Cases live at {@code <dataDir>/<casesDir>/<entity>/<case_id>.json}. Nothing here
 * saves implicitly: {@link #validate} only changes the in-memory case. Saves are plain
 * overwrites with no locking, so concurrent writers to one case file are not supported.
 */
@Slf4j
@Component
public class CaseStore {
    public static final String CASE_FILE_SUFFIX = ".json";

    private static final DateTimeFormatter CASE_ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss.SSSSSS");

    private final ObjectMapper objectMapper;
    private final TemplateStore templateStore;
    private final PdfFormProperties properties;
    private final Clock clock;
    private final AtomicReference<Instant> lastIdInstant = new AtomicReference<>(Instant.EPOCH);

    @Autowired
    public CaseStore(ObjectMapper objectMapper, TemplateStore templateStore, PdfFormProperties properties) {
        this(objectMapper, templateStore, properties, Clock.systemDefaultZone());
    }

    public CaseStore(ObjectMapper objectMapper, TemplateStore templateStore, PdfFormProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.templateStore = templateStore;
        this.properties = properties;
        this.clock = clock;
    }

    public CreatedCase create(String formCode, String caseName, String entityName) {
        return create(formCode, caseName, entityName, properties.dataPath());
    }

    /**
     * Create and save an empty case for {@code formCode} under {@code entityName}.
     */
    public CreatedCase create(String formCode, String caseName, String entityName, Path dataDir) {
        if (isBlank(formCode) || isBlank(entityName)) {
            throw new CaseException(ErrorCode.MALFORMED_CASE, Stage.CREATE,
                    "A case needs both a form code and an entity name");
        }
        requireFileSafe("form code", formCode, Stage.CREATE);
        requireFileSafe("entity name", entityName, Stage.CREATE);
        Instant now = clock.instant();
        String caseId = entityName + "_" + formCode + "_" + nextIdTimestamp(now);

        FormCase formCase = FormCase.builder()
                .caseMetadata(FormCase.CaseMetadata.builder()
                        .caseId(caseId)
                        .caseName(caseName)
                        .entityName(entityName)
                        .createdAt(now)
                        .build())
                .formReference(FormCase.FormReference.builder().formCode(formCode).build())
                .fields(new LinkedHashMap<>())
                .build();

        Path path = casesRoot(dataDir).resolve(entityName).resolve(caseId + CASE_FILE_SUFFIX);
        save(formCase, path);
        log.info("Created case {} for entity {}", caseId, entityName);
        return new CreatedCase(formCase, path);
    }

    public FormCase load(Path path) {
        byte[] json;
        try {
            json = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new CaseException(ErrorCode.NOT_FOUND, Stage.LOAD, "Case file not found: " + path, e);
        } catch (IOException e) {
            throw new CaseException(ErrorCode.IO_FAILURE, Stage.LOAD,
                    "Failed to read case " + path + ": " + e.getMessage(), e);
        }
        try {
            FormCase formCase = objectMapper.readValue(json, FormCase.class);
            if (formCase == null || formCase.getCaseMetadata() == null
                    || isBlank(formCase.getCaseMetadata().getCaseId())) {
                throw new CaseException(ErrorCode.MALFORMED_CASE, Stage.LOAD,
                        "Case file has no case_metadata.case_id: " + path);
            }
            if (formCase.getFields() == null) {
                formCase.setFields(new LinkedHashMap<>());
            }
            if (formCase.getFormReference() == null) {
                formCase.setFormReference(new FormCase.FormReference());
            }
            return formCase;
        } catch (JsonProcessingException e) {
            throw new CaseException(ErrorCode.MALFORMED_CASE, Stage.LOAD,
                    "Failed to parse case " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CaseException(ErrorCode.IO_FAILURE, Stage.LOAD,
                    "Failed to read case " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stamp {@code updated_at} and write the case, creating parent directories.
     */
    public void save(FormCase formCase, Path path) {
        formCase.getCaseMetadata().setUpdatedAt(clock.instant());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), formCase);
        } catch (IOException e) {
            throw new CaseException(ErrorCode.SAVE_FAILED, Stage.SAVE,
                    "Failed to save case " + path + ": " + e.getMessage(), e);
        }
        log.debug("Saved case {} to {}", formCase.getCaseMetadata().getCaseId(), path);
    }

    public List<Path> list(String entityName) {
        return list(properties.dataPath(), entityName);
    }

    /**
     * Case files of one entity, or of every entity when {@code entityName} is blank.
     * A missing directory yields an empty list.
     */
    public List<Path> list(Path dataDir, String entityName) {
        Path root = casesRoot(dataDir);
        if (!isBlank(entityName)) {
            requireFileSafe("entity name", entityName, Stage.LIST);
            root = root.resolve(entityName);
        }
        if (!Files.isDirectory(root)) {
            return new ArrayList<>();
        }
        Path scenarios = casesRoot(dataDir).resolve(PdfFormProperties.TEST_SCENARIOS_DIR);
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.startsWith(scenarios))
                    .filter(p -> p.getFileName().toString().endsWith(CASE_FILE_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CaseException(ErrorCode.IO_FAILURE, Stage.LOAD,
                    "Failed to list cases under " + root + ": " + e.getMessage(), e);
        }
    }

    public Path findById(String caseId) {
        return findById(caseId, properties.dataPath());
    }

    public Path findById(String caseId, Path dataDir) {
        String fileName = caseId + CASE_FILE_SUFFIX;
        return list(dataDir, null).stream()
                .filter(p -> p.getFileName().toString().equals(fileName))
                .findFirst()
                .orElseThrow(() -> new CaseException(ErrorCode.NOT_FOUND, Stage.LOAD, "Case not found: " + caseId));
    }

    /**
     * Record which template fields the case lacks. Extra case fields are ignored and
     * {@code fields} is never modified.
     */
    public FormCase.ValidationStatus validate(FormCase formCase, FormTemplate template) {
        List<String> missing = new ArrayList<>();
        for (String name : template.getFields().keySet()) {
            if (!formCase.getFields().containsKey(name)) {
                missing.add(name);
            }
        }
        FormCase.ValidationStatus status = FormCase.ValidationStatus.builder()
                .valid(missing.isEmpty())
                .missingFields(missing)
                .invalidFields(new ArrayList<>())
                .checkedAt(clock.instant())
                .build();
        formCase.setValidation(status);
        return status;
    }

    /**
     * Validate against the case's own template. A case without a template reference
     * has nothing to be checked against and is valid.
     */
    public FormCase.ValidationStatus validate(FormCase formCase) {
        String templatePath = formCase.getFormReference().getTemplatePath();
        if (isBlank(templatePath)) {
            return validate(formCase, new FormTemplate());
        }
        return validate(formCase, readTemplate(templatePath, Stage.VALIDATE));
    }

    /**
     * The document a case fills: its own reference, else its template's.
     */
    public String resolveDocumentReference(FormCase formCase) {
        FormCase.FormReference reference = formCase.getFormReference();
        if (reference != null && !isBlank(reference.getDocumentReference())) {
            return reference.getDocumentReference();
        }
        if (reference != null && !isBlank(reference.getTemplatePath())) {
            String fromTemplate = readTemplate(reference.getTemplatePath(), Stage.FILL_FROM_CASE).getDocumentReference();
            if (!isBlank(fromTemplate)) {
                return fromTemplate;
            }
        }
        throw new CaseException(ErrorCode.CANNOT_RESOLVE_DOCUMENT, Stage.FILL_FROM_CASE,
                "Cannot determine PDF path from case " + formCase.getCaseMetadata().getCaseId());
    }

    public Path casesRoot(Path dataDir) {
        return dataDir.resolve(properties.getCasesDir());
    }

    /**
     * Entity names and form codes become directory and file names, so they must stay
     * a single path segment.
     */
    private static void requireFileSafe(String label, String value, String stage) {
        if (value.indexOf('/') >= 0 || value.indexOf('\\') >= 0 || value.contains("..")
                || !value.equals(value.trim())) {
            throw new CaseException(ErrorCode.MALFORMED_CASE, stage,
                    "Invalid " + label + " '" + value + "': path separators, '..' and surrounding blanks are not allowed");
        }
    }

    private FormTemplate readTemplate(String templatePath, String stage) {
        try {
            return templateStore.read(Path.of(templatePath));
        } catch (NoSuchFileException e) {
            throw new CaseException(ErrorCode.NOT_FOUND, stage, "Template not found: " + templatePath, e);
        } catch (IOException e) {
            throw new CaseException(ErrorCode.MALFORMED_CASE, stage,
                    "Failed to read template " + templatePath + ": " + e.getMessage(), e);
        }
    }

    private String nextIdTimestamp(Instant now) {
        Instant candidate = now.truncatedTo(ChronoUnit.MICROS);
        Instant assigned = lastIdInstant.updateAndGet(last ->
                candidate.isAfter(last) ? candidate : last.plus(1, ChronoUnit.MICROS));
        return CASE_ID_TIMESTAMP.format(assigned.atZone(zone()));
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    public static class CreatedCase {
        FormCase formCase;
        Path path;
    }
}
