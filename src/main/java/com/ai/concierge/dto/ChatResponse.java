package com.ai.concierge.dto;

import com.ai.concierge.conversation.DateRange;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one chat turn. {@link Type} tells the caller how the answer was
 * produced so it can render canned replies, refusals and answers differently.
 */
public final class ChatResponse {

    public enum Type {
        ANSWER,
        GREETING,
        HELP,
        ACKNOWLEDGEMENT,
        CLARIFY,
        OUT_OF_SCOPE,
        NO_DOCUMENTS,
        UNAVAILABLE
    }

    private final Type type;
    private final String answer;
    private final String intent;
    private final String sessionId;
    private final List<SourceInfo> sources;
    private final List<String> suggestions;
    private final Map<String, Object> slots;

    private ChatResponse(Type type, String answer, String intent, String sessionId,
                         List<SourceInfo> sources, List<String> suggestions, Map<String, Object> slots) {
        this.type = type;
        this.answer = answer;
        this.intent = intent;
        this.sessionId = sessionId;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.slots = slots == null ? Collections.emptyMap() : toWire(slots);
    }

    public static ChatResponse of(Type type, String answer, String intent, String sessionId) {
        return new ChatResponse(type, answer, intent, sessionId, null, null, null);
    }

    public static ChatResponse answer(String answer, String intent, String sessionId, List<SourceInfo> sources,
                                      List<String> suggestions, Map<String, Object> slots) {
        return new ChatResponse(Type.ANSWER, answer, intent, sessionId, sources, suggestions, slots);
    }

    public ChatResponse withSlots(Map<String, Object> slots) {
        return new ChatResponse(type, answer, intent, sessionId, sources, suggestions, slots);
    }

    public Type getType() {
        return type;
    }

    public String getAnswer() {
        return answer;
    }

    public String getIntent() {
        return intent;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    public List<SourceInfo> getSources() {
        return sources;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public Map<String, Object> getSlots() {
        return Collections.unmodifiableMap(slots);
    }

    /** Date ranges become {start, end, nights} so the response needs no date support in the mapper. */
    private static Map<String, Object> toWire(Map<String, Object> slots) {
        Map<String, Object> out = new LinkedHashMap<>();
        slots.forEach((key, value) -> {
            if (value instanceof DateRange range) {
                Map<String, Object> dates = new LinkedHashMap<>();
                dates.put("start", range.start().toString());
                dates.put("end", range.end().toString());
                dates.put("nights", range.nights());
                out.put(key, dates);
            } else {
                out.put(key, value);
            }
        });
        return out;
    }
}
