package com.example.demo.pdfform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfiguration {

    @Bean
    public RestClient formRestClient(RestClient.Builder builder, PdfFormProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getFetchTimeout());
        requestFactory.setReadTimeout(properties.getFetchTimeout());
        return builder.requestFactory(requestFactory).build();
    }
}
