package com.example.demo.pdfform.template;

import com.example.demo.pdfform.model.FormTemplate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * JSON persistence for {@link FormTemplate}.
 */
@Component
public class TemplateStore {
    private final ObjectMapper objectMapper;

    public TemplateStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FormTemplate read(Path path) throws IOException {
        FormTemplate template = objectMapper.readValue(Files.readAllBytes(path), FormTemplate.class);
        if (template.getFields() == null) {
            template.setFields(new LinkedHashMap<>());
        }
        return template;
    }

    public void write(Path path, FormTemplate template) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), template);
    }
}
