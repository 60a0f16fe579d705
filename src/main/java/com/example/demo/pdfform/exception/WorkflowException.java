package com.example.demo.pdfform.exception;

import lombok.Getter;

/**
 * A workflow step failure. The message is prefixed with the step; code, stage and
 * cause are those of the step's own exception.
 */
@Getter
public class WorkflowException extends PdfFormException {
    private final String step;

    public WorkflowException(String step, PdfFormException cause) {
        super(cause.getCode(), cause.getStage(), "step '" + step + "' failed: " + cause.getDescription(), cause);
        this.step = step;
    }
}
