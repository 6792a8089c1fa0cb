package com.ai.concierge.conversation;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classified purpose of a single guest utterance.
 */
public enum Intent {
    GREETING,
    HELP,
    FAQ_QUESTION,
    STATEMENT,
    AFFIRMATIVE,
    NEGATIVE,
    CLARIFICATION_NEEDED,
    PRICING,
    AVAILABILITY,
    BOOKING,
    ROOMS,
    SAFETY,
    FACILITIES,
    LOCATION,
    UNKNOWN;

    private static final Set<Intent> INFORMATION = EnumSet.of(
            FAQ_QUESTION, PRICING, AVAILABILITY, BOOKING, ROOMS, SAFETY, FACILITIES, LOCATION, UNKNOWN);

    private static final Set<Intent> TOPICS = EnumSet.of(
            PRICING, AVAILABILITY, BOOKING, ROOMS, SAFETY, FACILITIES, LOCATION);

    /** Intents answered from the knowledge base rather than with a canned reply. */
    public boolean isInformationRequest() {
        return INFORMATION.contains(this);
    }

    public boolean isTopic() {
        return TOPICS.contains(this);
    }

    /** Lower-case name used in retrieval metadata filters. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
