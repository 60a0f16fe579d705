package com.example.demo.pdfform.fill;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class FillResult {
    /**
     * Final document: the flattened copy when flattening was requested, otherwise the filled one
     */
    Path outputPath;
    Path filledPath;
    Path inputDocument;
    boolean flattened;
    /**
     * Name of the strategy that produced the filled document
     */
    String strategy;
    /**
     * Why earlier strategies were skipped; null when the first one succeeded
     */
    String fallbackReason;
}
