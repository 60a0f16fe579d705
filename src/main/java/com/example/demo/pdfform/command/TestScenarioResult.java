package com.example.demo.pdfform.command;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class TestScenarioResult {
    String name;
    Path scenarioPath;
    /**
     * Filled document, null when the fill failed
     */
    Path outputPath;
    boolean expectError;
    boolean passed;
    /**
     * Fill failure message, or why a successful fill did not pass
     */
    String message;
}
