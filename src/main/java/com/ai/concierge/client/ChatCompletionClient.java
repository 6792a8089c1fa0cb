package com.ai.concierge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OpenAI-compatible Chat Completions client (OpenAI, Groq and similar hosts).
 */
public class ChatCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionClient.class);
    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;
    private final String apiKey;
    private final String model;
    private final double temperature;

    public ChatCompletionClient(RestTemplate restTemplate, String baseUrl, String apiKey, String model, double temperature) {
        this.restTemplate = restTemplate;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/chat/completions";
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public CompletionResult generate(String prompt, int maxTokens) {
        Map<String, Object> body = body(prompt, maxTokens, false);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers()), String.class);
            if (StringUtils.isBlank(response.getBody())) {
                return CompletionResult.failure(CompletionFailure.EMPTY, "Completion returned no body");
            }
            JsonNode root = mapper.readTree(response.getBody());
            String text = root.path("choices").path(0).path("message").path("content").asText("").trim();
            if (text.isEmpty()) {
                return CompletionResult.failure(CompletionFailure.EMPTY, "Completion returned no text");
            }
            return CompletionResult.success(text);
        } catch (RestClientException e) {
            log.warn("Completion request to {} failed", url, e);
            return CompletionResult.failure(CompletionFailure.TRANSPORT, e.getMessage());
        } catch (IOException e) {
            log.warn("Completion response could not be parsed", e);
            return CompletionResult.failure(CompletionFailure.BAD_RESPONSE, e.getMessage());
        }
    }

    @Override
    public CompletionResult stream(String prompt, int maxTokens, Consumer<String> onChunk) {
        Map<String, Object> body = body(prompt, maxTokens, true);
        HttpHeaders headers = headers();
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        try {
            StringBuilder full = new StringBuilder();
            restTemplate.execute(url, HttpMethod.POST,
                    request -> {
                        request.getHeaders().putAll(headers);
                        mapper.writeValue(request.getBody(), body);
                    },
                    response -> {
                        try (BufferedReader reader = new BufferedReader(
                                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                            String line;
                            while ((line = reader.readLine()) != null) {
                                String chunk = parseStreamLine(line);
                                if (chunk == null) continue;
                                if (DONE.equals(chunk)) break;
                                full.append(chunk);
                                onChunk.accept(chunk);
                            }
                        }
                        return null;
                    });
            if (full.length() == 0) {
                return CompletionResult.failure(CompletionFailure.EMPTY, "Completion stream returned no text");
            }
            return CompletionResult.success(full.toString());
        } catch (RestClientException e) {
            log.warn("Streaming completion request to {} failed", url, e);
            return CompletionResult.failure(CompletionFailure.TRANSPORT, e.getMessage());
        }
    }

    /** Content delta of one server-sent event line, {@code [DONE]} at the end, or null to skip. */
    String parseStreamLine(String line) throws IOException {
        if (line == null || !line.startsWith(DATA_PREFIX)) return null;
        String data = line.substring(DATA_PREFIX.length()).trim();
        if (data.isEmpty()) return null;
        if (DONE.equals(data)) return DONE;
        JsonNode delta = mapper.readTree(data).path("choices").path(0).path("delta").path("content");
        return delta.isMissingNode() || delta.isNull() ? null : delta.asText();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private Map<String, Object> body(String prompt, int maxTokens, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        if (stream) body.put("stream", true);
        return body;
    }
}
