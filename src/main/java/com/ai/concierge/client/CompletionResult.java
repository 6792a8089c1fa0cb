package com.ai.concierge.client;

/**
 * Outcome of a completion call: generated text, or a typed failure.
 */
public record CompletionResult(boolean success, String text, CompletionFailure failure, String message) {

    public static CompletionResult success(String text) {
        return new CompletionResult(true, text, null, null);
    }

    public static CompletionResult failure(CompletionFailure failure, String message) {
        return new CompletionResult(false, "", failure, message);
    }

    public String textOrEmpty() {
        return text == null ? "" : text;
    }
}
