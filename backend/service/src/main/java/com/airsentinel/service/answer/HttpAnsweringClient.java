package com.airsentinel.service.answer;

import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.answer.Answer;
import com.airsentinel.pipeline.answer.AnsweringService;
import com.airsentinel.pipeline.answer.AnsweringUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public final class HttpAnsweringClient implements AnsweringService {
    private final HttpClient httpClient;
    private final Duration timeout;
    private final String url;

    public HttpAnsweringClient(HttpClient httpClient, Duration timeout, String url) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.url = url == null ? "" : url.trim();
    }

    public boolean isConfigured() {
        return !url.isBlank();
    }

    @Override
    public Answer answer(String question, Double liveCo2Ppm) {
        if (!isConfigured()) {
            throw new AnsweringUnavailableException("Answering service URL is not configured");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("question", question);
        body.put("live_co2", liveCo2Ppm);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(JsonUtils.objectMapper().writeValueAsBytes(body)))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AnsweringUnavailableException("Failed to build answering request for " + url, e);
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new AnsweringUnavailableException("Answering service returned status " + response.statusCode());
            }
            return JsonUtils.objectMapper().readValue(response.body(), Answer.class);
        } catch (JsonProcessingException e) {
            throw new AnsweringUnavailableException("Answering service returned an unreadable body", e);
        } catch (IOException e) {
            throw new AnsweringUnavailableException("Answering service unreachable at " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnsweringUnavailableException("Interrupted while waiting for answering service", e);
        }
    }
}
