package com.ai.concierge.client;

import java.util.function.Consumer;

/**
 * Hosted language-model completion service. Implementations never throw for
 * transport or payload problems; they report them in the {@link CompletionResult}.
 */
public interface CompletionClient {

    CompletionResult generate(String prompt, int maxTokens);

    /**
     * Streams generated text to {@code onChunk} as it arrives. The returned
     * result carries the full concatenated text.
     */
    CompletionResult stream(String prompt, int maxTokens, Consumer<String> onChunk);

    default boolean isConfigured() {
        return true;
    }
}
