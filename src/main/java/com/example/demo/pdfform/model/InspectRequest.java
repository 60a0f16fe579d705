package com.example.demo.pdfform.model;

import lombok.Data;

@Data
public class InspectRequest {
    private String pdfPath;
    /**
     * Template file or directory; defaults to the configured templates directory
     */
    private String output;
}
