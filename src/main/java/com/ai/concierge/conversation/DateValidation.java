package com.ai.concierge.conversation;

/**
 * Outcome of checking a parsed stay against booking limits.
 */
public record DateValidation(boolean valid, String reason) {

    public static DateValidation ok() {
        return new DateValidation(true, null);
    }

    public static DateValidation invalid(String reason) {
        return new DateValidation(false, reason);
    }
}
