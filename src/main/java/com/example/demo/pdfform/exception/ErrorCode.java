package com.example.demo.pdfform.exception;

/**
 * Error kinds surfaced by the form commands.
 */
public enum ErrorCode {
    // catalog
    MALFORMED_SOURCE,
    NOT_FOUND,

    // download
    NO_SOURCE,
    FETCH_FAILED,
    /** Advisory only, never terminates a command */
    METADATA_WRITE_FAILED,

    // extraction
    LIST_FIELDS_FAILED,
    EXPORT_FAILED,

    // fill
    DOCUMENT_NOT_FOUND,
    INVALID_DOCUMENT_REFERENCE,
    /** Recovered by the secondary strategy, never surfaced as the final error */
    PRIMARY_FILL_FAILED,
    SECONDARY_FILL_FAILED,
    FLATTEN_FAILED,

    // cases
    MALFORMED_CASE,
    CANNOT_RESOLVE_DOCUMENT,
    SAVE_FAILED,

    IO_FAILURE
}
