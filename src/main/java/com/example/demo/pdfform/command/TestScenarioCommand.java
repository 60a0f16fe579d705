package com.example.demo.pdfform.command;

import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.TestScenarioEventData;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.fill.FillEngine;
import com.example.demo.pdfform.fill.FillRequest;
import com.example.demo.pdfform.fill.FillResult;
import com.example.demo.pdfform.fill.OutputPaths;
import com.example.demo.pdfform.model.TestScenario;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs saved fill scenarios and reports whether the outcome matched {@code expect_error}.
 *
 * A scenario that ran ends with {@code test.completed} whether it passed or not;
 * {@code test.error} means the scenario itself could not be loaded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TestScenarioCommand {
    private final FillEngine fillEngine;
    private final ObjectMapper objectMapper;
    private final EventPublisher events;

    public TestScenarioResult run(Path scenarioPath, Path outputDir) {
        TestScenarioEventData data = TestScenarioEventData.builder()
                .scenarioPath(scenarioPath.toString())
                .build();
        events.emit(EventType.TEST_STARTED, data);

        TestScenario scenario;
        try {
            scenario = load(scenarioPath);
        } catch (PdfFormException e) {
            events.emitError(EventType.TEST_ERROR, e, data.toBuilder().stage(e.getStage()).build());
            throw e;
        }

        Path outputPath = outputDir.resolve(scenario.getName() + OutputPaths.FILLED_SUFFIX);
        data = data.toBuilder()
                .scenarioName(scenario.getName())
                .outputPath(outputPath.toString())
                .expectError(scenario.isExpectError())
                .build();

        TestScenarioResult.TestScenarioResultBuilder result = TestScenarioResult.builder()
                .name(scenario.getName())
                .scenarioPath(scenarioPath)
                .expectError(scenario.isExpectError());
        try {
            FillResult filled = fillEngine.fill(FillRequest.builder()
                    .documentReference(scenario.getDocumentReference())
                    .fields(scenario.getFields())
                    .outputPath(outputPath)
                    .build());
            result.outputPath(filled.getOutputPath())
                    .passed(!scenario.isExpectError())
                    .message(scenario.isExpectError() ? "expected error but got success" : null);
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, Stage.RUN_SCENARIO);
            log.info("Scenario '{}' fill failed: {}", scenario.getName(), failure.getMessage());
            result.passed(scenario.isExpectError()).message(failure.getMessage());
        }

        TestScenarioResult outcome = result.build();
        events.emit(EventType.TEST_COMPLETED, data.toBuilder()
                .passed(outcome.isPassed())
                .stage(Stage.RUN_SCENARIO)
                .build());
        log.info("Scenario '{}' {}", outcome.getName(), outcome.isPassed() ? "passed" : "failed");
        return outcome;
    }

    /**
     * Run every scenario in {@code scenarioDir}. A scenario that cannot be loaded is reported
     * as failed and does not stop the others.
     */
    public List<TestScenarioResult> runAll(Path scenarioDir, Path outputDir) {
        List<TestScenarioResult> results = new ArrayList<>();
        for (Path scenarioPath : listScenarios(scenarioDir)) {
            try {
                results.add(run(scenarioPath, outputDir));
            } catch (PdfFormException e) {
                results.add(TestScenarioResult.builder()
                        .name(OutputPaths.baseName(scenarioPath))
                        .scenarioPath(scenarioPath)
                        .passed(false)
                        .message(e.getMessage())
                        .build());
            }
        }
        return results;
    }

    public List<Path> listScenarios(Path scenarioDir) {
        if (!Files.isDirectory(scenarioDir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(scenarioDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PdfFormException(ErrorCode.IO_FAILURE, Stage.LOAD_SCENARIO,
                    "Failed to list test scenarios in " + scenarioDir + ": " + e.getMessage(), e);
        }
    }

    TestScenario load(Path scenarioPath) {
        try {
            TestScenario scenario = objectMapper.readValue(Files.readAllBytes(scenarioPath), TestScenario.class);
            if (scenario.getName() == null || scenario.getName().isBlank()) {
                scenario.setName(OutputPaths.baseName(scenarioPath));
            }
            return scenario;
        } catch (NoSuchFileException e) {
            throw new PdfFormException(ErrorCode.NOT_FOUND, Stage.LOAD_SCENARIO,
                    "Test scenario not found: " + scenarioPath, e);
        } catch (IOException e) {
            throw new PdfFormException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_SCENARIO,
                    "Failed to read test scenario " + scenarioPath + ": " + e.getMessage(), e);
        }
    }
}
