package com.example.demo.pdfform.exception;

/**
 * Raised while loading or querying the forms catalog.
 */
public class CatalogException extends PdfFormException {

    public CatalogException(ErrorCode code, String stage, String description) {
        super(code, stage, description);
    }

    public CatalogException(ErrorCode code, String stage, String description, Throwable cause) {
        super(code, stage, description, cause);
    }
}
