package com.example.demo.pdfform.model;

import lombok.Data;

/**
 * Fill from a template file ({@code templatePath}) or an inline {@code template}.
 */
@Data
public class FillFormRequest {
    private String templatePath;
    private FormTemplate template;
    /**
     * Output file or directory; defaults to the configured outputs directory
     */
    private String output;
    private boolean flatten;
}
