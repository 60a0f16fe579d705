package com.example.demo.pdfform.fill;

import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.FillException;
import com.example.demo.pdfform.exception.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Strategy ordering and fallback of the FillEngine, with mocked strategies
 */
public class FillEngineTest {
    @TempDir
    Path dir;

    private FillStrategy primary;
    private FillStrategy secondary;
    private FormFetcher fetcher;
    private FillEngine engine;
    private Path document;

    @BeforeEach
    public void setUp() throws IOException {
        primary = mock(FillStrategy.class);
        secondary = mock(FillStrategy.class);
        when(primary.name()).thenReturn("primary");
        when(secondary.name()).thenReturn("secondary");
        fetcher = mock(FormFetcher.class);

        PdfFormProperties properties = PdfFormProperties.forDataDir(dir.resolve("data"));
        engine = new FillEngine(List.of(primary, secondary), new DocumentResolver(fetcher, properties));
        document = Files.write(dir.resolve("f3520.pdf"), new byte[]{1});
    }

    @Test
    public void testSecondaryNeverRunsWhenPrimarySucceeds() throws IOException {
        FillResult result = engine.fill(request(Map.of("Name", "Alice")));

        assertEquals("primary", result.getStrategy());
        assertNull(result.getFallbackReason());
        assertEquals(dir.resolve("out").resolve("f3520_filled.pdf"), result.getOutputPath());
        assertEquals(document, result.getInputDocument());
        assertFalse(result.isFlattened());
        verify(primary).fill(eq(document), eq(Map.of("Name", "Alice")), eq(result.getFilledPath()));
        verify(secondary, never()).fill(any(), anyMap(), any());
    }

    @Test
    public void testSecondaryRunsWithSameValuesWhenPrimaryFails() throws IOException {
        doThrow(new IOException("cannot encode value")).when(primary).fill(any(), anyMap(), any());

        FillResult result = engine.fill(request(Map.of("Name", "Alice")));

        assertEquals("secondary", result.getStrategy());
        assertTrue(result.getFallbackReason().contains("cannot encode value"));
        verify(secondary).fill(eq(document), eq(Map.of("Name", "Alice")), eq(result.getFilledPath()));
    }

    @Test
    public void testUncheckedPrimaryFailureAlsoFallsBack() throws IOException {
        doThrow(new IllegalStateException("signed document")).when(primary).fill(any(), anyMap(), any());

        assertEquals("secondary", engine.fill(request(Map.of())).getStrategy());
    }

    @Test
    public void testSecondaryErrorIsSurfacedWhenBothFail() throws IOException {
        IOException primaryError = new IOException("primary broke");
        IOException secondaryError = new IOException("secondary broke");
        doThrow(primaryError).when(primary).fill(any(), anyMap(), any());
        doThrow(secondaryError).when(secondary).fill(any(), anyMap(), any());

        FillException e = assertThrows(FillException.class, () -> engine.fill(request(Map.of("Name", "Alice"))));

        assertEquals(ErrorCode.SECONDARY_FILL_FAILED, e.getCode());
        assertEquals(Stage.FILL_PDF, e.getStage());
        assertSame(secondaryError, e.getCause());
        assertTrue(e.getMessage().contains("secondary broke"));
        assertEquals(1, e.getSuppressed().length);
        assertSame(primaryError, e.getSuppressed()[0]);
    }

    @Test
    public void testMissingLocalDocumentIsNotFound() {
        FillException e = assertThrows(FillException.class, () -> engine.fill(FillRequest.builder()
                .documentReference(dir.resolve("missing.pdf").toString())
                .build()));

        assertEquals(ErrorCode.DOCUMENT_NOT_FOUND, e.getCode());
        assertEquals(Stage.RESOLVE_DOCUMENT, e.getStage());
        verifyNoInteractions(fetcher);
    }

    @Test
    public void testBlankReferenceIsInvalid() {
        FillException e = assertThrows(FillException.class,
                () -> engine.fill(FillRequest.builder().documentReference("  ").build()));

        assertEquals(ErrorCode.INVALID_DOCUMENT_REFERENCE, e.getCode());
    }

    @Test
    public void testRemoteDocumentIsFetchedToTempDirectory() throws IOException {
        FillResult result = engine.fill(FillRequest.builder()
                .documentReference("https://host/forms/f3520.pdf")
                .outputDir(dir.resolve("out"))
                .build());

        Path fetched = result.getInputDocument();
        assertEquals(tempDir(), fetched.getParent());
        assertEquals(dir.resolve("out").resolve("f3520_filled.pdf"), result.getOutputPath());
        verify(fetcher).fetch("https://host/forms/f3520.pdf", fetched);
    }

    @Test
    public void testFetchedCopiesAreRemovedAfterEachFill() throws IOException {
        for (int i = 0; i < 3; i++) {
            engine.fill(FillRequest.builder()
                    .documentReference("https://host/forms/f3520.pdf")
                    .outputDir(dir.resolve("out"))
                    .build());
        }

        assertEquals(List.of(), tempFiles());
    }

    @Test
    public void testFetchedCopyIsRemovedWhenBothStrategiesFail() throws IOException {
        doThrow(new IOException("primary broke")).when(primary).fill(any(), anyMap(), any());
        doThrow(new IOException("secondary broke")).when(secondary).fill(any(), anyMap(), any());

        assertThrows(FillException.class, () -> engine.fill(FillRequest.builder()
                .documentReference("https://host/forms/f3520.pdf")
                .outputDir(dir.resolve("out"))
                .build()));

        assertEquals(List.of(), tempFiles());
    }

    @Test
    public void testFailedFetchIsDocumentNotFound() throws IOException {
        doThrow(new IOException("404")).when(fetcher).fetch(any(), any());

        FillException e = assertThrows(FillException.class, () -> engine.fill(FillRequest.builder()
                .documentReference("https://host/forms/f3520.pdf")
                .build()));

        assertEquals(ErrorCode.DOCUMENT_NOT_FOUND, e.getCode());
        assertEquals(List.of(), tempFiles());
        verifyNoInteractions(primary);
    }

    @Test
    public void testExplicitOutputPathWins() {
        Path explicit = dir.resolve("custom").resolve("mine.pdf");

        FillResult result = engine.fill(FillRequest.builder()
                .documentReference(document.toString())
                .outputPath(explicit)
                .outputDir(dir.resolve("ignored"))
                .build());

        assertEquals(explicit, result.getOutputPath());
        assertTrue(Files.isDirectory(explicit.getParent()));
        assertFalse(Files.exists(dir.resolve("ignored")));
    }

    private Path tempDir() {
        return dir.resolve("data").resolve("temp");
    }

    private List<Path> tempFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir())) {
            return files.collect(Collectors.toList());
        }
    }

    private FillRequest request(Map<String, String> fields) {
        return FillRequest.builder()
                .documentReference(document.toString())
                .fields(fields)
                .outputDir(dir.resolve("out"))
                .build();
    }
}
