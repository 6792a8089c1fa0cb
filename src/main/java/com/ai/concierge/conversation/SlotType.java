package com.ai.concierge.conversation;

public enum SlotType {
    INTEGER,
    ENUM,
    DATE_RANGE,
    BOOLEAN,
    TEXT
}
