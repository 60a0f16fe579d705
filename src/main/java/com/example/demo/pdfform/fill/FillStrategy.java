package com.example.demo.pdfform.fill;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * One way of writing field values into a fillable PDF.
 *
 * Implementations read {@code source}, apply {@code fields} and save the result to
 * {@code target}. Any exception means the strategy could not fill this document.
 */
public interface FillStrategy {

    String name();

    void fill(Path source, Map<String, String> fields, Path target) throws IOException;
}
