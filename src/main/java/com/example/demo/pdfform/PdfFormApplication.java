package com.example.demo.pdfform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class PdfFormApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfFormApplication.class, args);
    }
}
