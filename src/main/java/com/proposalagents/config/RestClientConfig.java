package com.proposalagents.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Configuration
@Slf4j
public class RestClientConfig {

    static final String HTTP_LOGGER_NAME = "com.proposalagents.http.logging";

    // Provider calls outlive the caller's timeout by this much before the socket gives up.
    private static final Duration READ_TIMEOUT_GRACE = Duration.ofSeconds(30);

    @Bean
    public RestClientCustomizer restClientCustomizer(ProposalAgentsProperties properties) {
        Duration longest = properties.getTaskTimeout().compareTo(properties.getSynthesisTimeout()) >= 0
                ? properties.getTaskTimeout()
                : properties.getSynthesisTimeout();
        Duration readTimeout = longest.plus(READ_TIMEOUT_GRACE);
        log.info("Provider HTTP client configured. readTimeout={}, httpLogging={}.", readTimeout, properties.isHttpLogging());
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setReadTimeout(readTimeout);
            if (properties.isHttpLogging()) {
                restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
                // Buffering lets the interceptor read the response body without consuming it
                restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(requestFactory));
            } else {
                restClientBuilder.requestFactory(requestFactory);
            }
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger(HTTP_LOGGER_NAME);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.info("--- HTTP Request ---");
            httpLogger.info("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.info("Headers: {}", redactedHeaders(request));
            if (body.length > 0) {
                httpLogger.info("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.info("--------------------");
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.info("--- HTTP Response ---");
            try {
                httpLogger.info("Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.info("Status: Unknown");
            }
            httpLogger.info("Headers: {}", response.getHeaders());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.info("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.info("---------------------");
        }

        private static String redactedHeaders(HttpRequest request) {
            var copy = new org.springframework.http.HttpHeaders();
            request.getHeaders().forEach((name, values) -> {
                boolean secret = name.equalsIgnoreCase("Authorization") || name.equalsIgnoreCase("x-goog-api-key");
                copy.put(name, secret ? java.util.List.of("***") : values);
            });
            return copy.toString();
        }
    }
}
