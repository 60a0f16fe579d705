package com.example.demo.pdfform.exception;

/**
 * Raised by the fill engine.
 */
public class FillException extends PdfFormException {

    public FillException(ErrorCode code, String stage, String description) {
        super(code, stage, description);
    }

    public FillException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code, stage, description, cause);
    }
}
