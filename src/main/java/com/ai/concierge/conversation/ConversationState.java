package com.ai.concierge.conversation;

/**
 * Coarse stage of a guest's journey, used to order follow-up suggestions.
 */
public enum ConversationState {
    BROWSING,
    COMPARING,
    INQUIRING,
    READY_TO_BOOK,
    BOOKING,
    COMPLETED
}
