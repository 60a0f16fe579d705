package com.example.demo.pdfform.fill;

import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.FillException;
import com.example.demo.pdfform.support.FormFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Both fill strategies and flattening against real PDFs built with PDFBox
 */
public class FillStrategiesTest {
    @TempDir
    Path dir;

    private Path form;
    private FillEngine engine;

    @BeforeEach
    public void setUp() throws IOException {
        form = FormFixtures.textForm(dir.resolve("transfer.pdf"), "Name", "Date");
        engine = new FillEngine(List.of(new AcroFormFillStrategy(), new CosDictionaryFillStrategy()),
                new DocumentResolver(mock(FormFetcher.class), PdfFormProperties.forDataDir(dir)));
    }

    @Test
    public void testPrimaryWritesValues() throws IOException {
        Path target = dir.resolve("primary.pdf");

        new AcroFormFillStrategy().fill(form, Map.of("Name", "Alice", "Date", "2024-05-01"), target);

        Map<String, String> values = FormFixtures.values(target);
        assertEquals("Alice", values.get("Name"));
        assertEquals("2024-05-01", values.get("Date"));
    }

    @Test
    public void testPrimaryRejectsUnknownField() {
        IOException e = assertThrows(IOException.class, () -> new AcroFormFillStrategy()
                .fill(form, Map.of("Nickname", "Al"), dir.resolve("x.pdf")));

        assertTrue(e.getMessage().contains("Nickname"));
        assertFalse(Files.exists(dir.resolve("x.pdf")));
    }

    @Test
    public void testSecondarySkipsUnknownFieldsWithoutAddingThem() throws IOException {
        Path target = dir.resolve("secondary.pdf");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Name", "Bob");
        fields.put("Nickname", "B");

        new CosDictionaryFillStrategy().fill(form, fields, target);

        Map<String, String> values = FormFixtures.values(target);
        assertEquals("Bob", values.get("Name"));
        assertEquals(List.of("Name", "Date"), List.copyOf(values.keySet()));
    }

    @Test
    public void testEngineFallsBackWhenPrimaryRejectsDocument() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Name", "Carol");
        fields.put("Unknown", "ignored");

        FillResult result = engine.fill(FillRequest.builder()
                .documentReference(form.toString())
                .fields(fields)
                .outputDir(dir.resolve("out"))
                .build());

        assertEquals(CosDictionaryFillStrategy.NAME, result.getStrategy());
        assertNotNull(result.getFallbackReason());
        assertTrue(Files.exists(dir.resolve("out").resolve("transfer_filled.pdf")));
    }

    @Test
    public void testFlattenWritesLockedCopyAndKeepsFilledDocument() throws IOException {
        FillResult result = engine.fill(FillRequest.builder()
                .documentReference(form.toString())
                .fields(Map.of("Name", "Dave", "Date", "today"))
                .outputDir(dir.resolve("out"))
                .flatten(true)
                .build());

        assertEquals(AcroFormFillStrategy.NAME, result.getStrategy());
        assertTrue(result.isFlattened());
        assertEquals(dir.resolve("out").resolve("transfer_filled.pdf"), result.getFilledPath());
        assertEquals(dir.resolve("out").resolve("transfer_filled_flat.pdf"), result.getOutputPath());
        assertTrue(Files.exists(result.getFilledPath()));

        assertTrue(FormFixtures.readOnlyFlags(result.getOutputPath()).values().stream().allMatch(Boolean::booleanValue));
        assertFalse(FormFixtures.readOnlyFlags(result.getFilledPath()).get("Name"));
        assertEquals("Dave", FormFixtures.values(result.getOutputPath()).get("Name"));
    }

    @Test
    public void testFlattenFailureKeepsFilledFile() throws IOException {
        Path filled = Files.writeString(dir.resolve("broken_filled.pdf"), "not a pdf");

        FillException e = assertThrows(FillException.class, () -> engine.flatten(filled));

        assertEquals(ErrorCode.FLATTEN_FAILED, e.getCode());
        assertEquals("not a pdf", Files.readString(filled));
        assertFalse(Files.exists(dir.resolve("broken_filled_flat.pdf")));
    }

    @Test
    public void testDocumentWithoutFormFailsBothStrategies() throws IOException {
        Path plain = FormFixtures.plainDocument(dir.resolve("plain.pdf"));

        FillException e = assertThrows(FillException.class, () -> engine.fill(FillRequest.builder()
                .documentReference(plain.toString())
                .fields(Map.of("Name", "Eve"))
                .outputDir(dir.resolve("out"))
                .build()));

        assertEquals(ErrorCode.SECONDARY_FILL_FAILED, e.getCode());
        assertEquals(1, e.getSuppressed().length);
    }
}
