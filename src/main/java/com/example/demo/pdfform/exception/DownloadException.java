package com.example.demo.pdfform.exception;

/**
 * Raised when a catalog form cannot be fetched.
 */
public class DownloadException extends PdfFormException {

    public DownloadException(ErrorCode code, String stage, String description) {
        super(code, stage, description);
    }

    public DownloadException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code, stage, description, cause);
    }
}
