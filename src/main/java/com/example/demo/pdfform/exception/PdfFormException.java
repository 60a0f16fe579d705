package com.example.demo.pdfform.exception;

import lombok.Getter;

/**
 * Base exception for form operations. Carries a machine-readable code and the
 * internal stage that failed so callers never need to parse the message.
 */
@Getter
public class PdfFormException extends RuntimeException {
    private final ErrorCode code;
    private final String stage;
    private final String description;

    public PdfFormException(ErrorCode code, String stage, String description) {
        this(code, stage, description, null);
    }

    public PdfFormException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.stage = stage;
        this.description = description;
    }
}
