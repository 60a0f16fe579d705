package com.example.demo.pdfform.model;

import lombok.Data;

@Data
public class CreateCaseRequest {
    private String formCode;
    private String caseName;
    private String entityName;
}
