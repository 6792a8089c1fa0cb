package com.ai.concierge.client;

import com.ai.concierge.dto.RetrievedDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a JSON search endpoint: {@code POST {base}/search} with
 * {@code {query, k, filter}}, answered by {@code {documents: [{content, metadata, score}]}}.
 */
public class HttpRetrievalClient implements RetrievalClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRetrievalClient.class);
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;

    public HttpRetrievalClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.url = StringUtils.removeEnd(baseUrl, "/") + "/search";
    }

    @Override
    public RetrievalResult search(String query, int k, Map<String, String> filter) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("k", k);
        if (filter != null && !filter.isEmpty()) body.put("filter", filter);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            List<RetrievedDocument> documents = new ArrayList<>();
            for (JsonNode node : root.path("documents")) {
                Map<String, Object> metadata = node.has("metadata")
                        ? mapper.convertValue(node.get("metadata"), METADATA)
                        : Map.of();
                documents.add(new RetrievedDocument(
                        node.path("content").asText(""),
                        metadata,
                        node.path("score").asDouble(0.0)));
            }
            log.debug("Retrieved {} documents for '{}' (k={}, filter={})", documents.size(), query, k, filter);
            return RetrievalResult.of(documents);
        } catch (RestClientException e) {
            log.warn("Retrieval request to {} failed", url, e);
            return RetrievalResult.failure(RetrievalFailure.TRANSPORT, e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Retrieval response could not be parsed", e);
            return RetrievalResult.failure(RetrievalFailure.BAD_RESPONSE, e.getMessage());
        }
    }
}
