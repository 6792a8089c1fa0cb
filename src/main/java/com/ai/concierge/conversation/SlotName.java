package com.ai.concierge.conversation;

import java.util.Optional;

/**
 * Pieces of booking information collected across a conversation.
 */
public enum SlotName {
    GUESTS("guests"),
    COTTAGE_ID("cottage_id"),
    DATES("dates"),
    FAMILY("family"),
    NIGHTS("nights"),
    SEASON("season"),
    BUDGET("budget"),
    PREFERENCES("preferences");

    private final String key;

    SlotName(String key) {
        this.key = key;
    }

    /** Wire name used in persisted sessions, prompts and responses. */
    public String key() {
        return key;
    }

    public static Optional<SlotName> fromKey(String key) {
        for (SlotName name : values()) {
            if (name.key.equalsIgnoreCase(key)) return Optional.of(name);
        }
        return Optional.empty();
    }
}
