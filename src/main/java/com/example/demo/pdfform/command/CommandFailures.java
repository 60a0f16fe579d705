package com.example.demo.pdfform.command;

import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;

/**
 * Normalises anything a command step throws into a {@link PdfFormException}, so every
 * failure has a code and a stage for its error event.
 */
final class CommandFailures {

    private CommandFailures() {
    }

    static PdfFormException asFormException(RuntimeException failure, String stage) {
        if (failure instanceof PdfFormException) {
            return (PdfFormException) failure;
        }
        return new PdfFormException(ErrorCode.IO_FAILURE, stage, String.valueOf(failure.getMessage()), failure);
    }
}
