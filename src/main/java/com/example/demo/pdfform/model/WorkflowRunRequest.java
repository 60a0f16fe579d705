package com.example.demo.pdfform.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single form ({@code formCode} + {@code fields}) or bulk ({@code formCodes} + {@code fieldData}).
 */
@Data
public class WorkflowRunRequest {
    private String formCode;
    private Map<String, String> fields = new LinkedHashMap<>();
    private List<String> formCodes = new ArrayList<>();
    private Map<String, Map<String, String>> fieldData = new LinkedHashMap<>();
    private String outputDir;
    private boolean flatten;
}
