package com.ai.concierge.client;

import java.util.function.Consumer;

/**
 * Used when no API key is set. Every call reports {@link CompletionFailure#NOT_CONFIGURED}.
 */
public class DisabledCompletionClient implements CompletionClient {

    private static final String MESSAGE = "Completion service API key is not set";

    @Override
    public CompletionResult generate(String prompt, int maxTokens) {
        return CompletionResult.failure(CompletionFailure.NOT_CONFIGURED, MESSAGE);
    }

    @Override
    public CompletionResult stream(String prompt, int maxTokens, Consumer<String> onChunk) {
        return CompletionResult.failure(CompletionFailure.NOT_CONFIGURED, MESSAGE);
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
