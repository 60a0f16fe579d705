package com.example.demo.pdfform.model;

import lombok.Data;

/**
 * POST /api/forms/download
 * {
 *   "formCode": "F3520",
 *   "outputDir": "/tmp/forms"
 * }
 */
@Data
public class DownloadRequest {
    private String formCode;
    /**
     * Defaults to the configured downloads directory
     */
    private String outputDir;
}
