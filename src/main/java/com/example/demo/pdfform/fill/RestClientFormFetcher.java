package com.example.demo.pdfform.fill;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Component
public class RestClientFormFetcher implements FormFetcher {
    private final RestClient restClient;

    public RestClientFormFetcher(RestClient formRestClient) {
        this.restClient = formRestClient;
    }

    @Override
    @LogExecutionTime("Fetching Remote Form")
    public void fetch(String url, Path target) throws IOException {
        log.info("Downloading {} to {}", url, target);
        byte[] body;
        try {
            body = restClient.get()
                    .uri(URI.create(url.trim()))
                    .accept(MediaType.APPLICATION_PDF, MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new IOException("Failed to download " + url + ": " + e.getMessage(), e);
        }
        if (body == null || body.length == 0) {
            throw new IOException("Empty response body from " + url);
        }
        Files.write(target, body);
        log.debug("Wrote {} bytes to {}", body.length, target);
    }
}
