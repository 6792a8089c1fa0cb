package com.ai.concierge.config;

import com.ai.concierge.client.ChatCompletionClient;
import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.DisabledCompletionClient;
import com.ai.concierge.client.HttpRetrievalClient;
import com.ai.concierge.client.RetrievalClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the external collaborators: completion service, retrieval service and the clock.
 */
@Configuration
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    @Bean
    public CompletionClient completionClient(RestTemplateBuilder builder,
                                             @Value("${completion.base-url:https://api.groq.com/openai/v1}") String baseUrl,
                                             @Value("${completion.api-key:}") String apiKey,
                                             @Value("${completion.model:llama-3.1-8b-instant}") String model,
                                             @Value("${completion.temperature:0.1}") double temperature,
                                             @Value("${completion.timeout-seconds:30}") long timeoutSeconds) {
        if (StringUtils.isBlank(apiKey)) {
            log.warn("completion.api-key is not set; completion fallbacks and generated answers are disabled");
            return new DisabledCompletionClient();
        }
        log.info("Completion service {} with model {}", baseUrl, model);
        return new ChatCompletionClient(
                builder.setConnectTimeout(Duration.ofSeconds(10))
                        .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                        .build(),
                baseUrl, apiKey, model, temperature);
    }

    @Bean
    public RetrievalClient retrievalClient(RestTemplateBuilder builder,
                                           @Value("${retrieval.base-url:http://localhost:8001}") String baseUrl,
                                           @Value("${retrieval.timeout-seconds:10}") long timeoutSeconds) {
        return new HttpRetrievalClient(
                builder.setConnectTimeout(Duration.ofSeconds(5))
                        .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                        .build(),
                baseUrl);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
