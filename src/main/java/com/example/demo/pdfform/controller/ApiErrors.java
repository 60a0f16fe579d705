package com.example.demo.pdfform.controller;

import com.example.demo.pdfform.exception.PdfFormException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error responses for the REST endpoints: {@code {code, description, stage}}.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<Map<String, String>> toResponse(PdfFormException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", e.getCode().name());
        body.put("description", e.getDescription());
        body.put("stage", e.getStage());
        return new ResponseEntity<>(body, status(e));
    }

    static HttpStatus status(PdfFormException e) {
        switch (e.getCode()) {
            case NOT_FOUND:
            case DOCUMENT_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case NO_SOURCE:
            case MALFORMED_SOURCE:
            case MALFORMED_CASE:
            case INVALID_DOCUMENT_REFERENCE:
            case CANNOT_RESOLVE_DOCUMENT:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
