package com.example.demo.pdfform.exception;

/**
 * Raised by the case store.
 */
public class CaseException extends PdfFormException {

    public CaseException(ErrorCode code, String stage, String description) {
        super(code, stage, description);
    }

    public CaseException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code, stage, description, cause);
    }
}
