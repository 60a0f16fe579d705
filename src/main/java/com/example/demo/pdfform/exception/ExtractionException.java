package com.example.demo.pdfform.exception;

/**
 * Raised when fillable fields cannot be listed or exported.
 */
public class ExtractionException extends PdfFormException {

    public ExtractionException(ErrorCode code, String stage, String description) {
        super(code, stage, description);
    }

    public ExtractionException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code, stage, description, cause);
    }
}
