package com.example.demo.pdfform.fill;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetches a remote document to a local file.
 */
public interface FormFetcher {

    void fetch(String url, Path target) throws IOException;
}
