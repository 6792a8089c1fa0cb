package com.ai.concierge.conversation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks where a guest is in their journey from the intents they express.
 */
public class ContextTracker {

    private static final int MAX_INTENTS = 10;
    private static final int MAX_SUMMARY = 20;
    private static final int MAX_KEY_POINTS = 20;
    private static final Set<Intent> EXPLORING = EnumSet.of(Intent.PRICING, Intent.AVAILABILITY, Intent.ROOMS);

    private final Deque<Intent> intents = new ArrayDeque<>();
    private final Map<String, Object> preferences = new LinkedHashMap<>();
    private final List<String> summary = new ArrayList<>();
    private final List<String> keyPoints = new ArrayList<>();
    private ConversationState state = ConversationState.BROWSING;

    public void addIntent(Intent intent) {
        if (intent == null) return;
        intents.addLast(intent);
        while (intents.size() > MAX_INTENTS) intents.removeFirst();
        updateState(intent);
    }

    private void updateState(Intent latest) {
        if (latest == Intent.BOOKING) {
            state = ConversationState.BOOKING;
        } else if (EXPLORING.contains(latest)) {
            Set<Intent> recentTopics = new HashSet<>();
            for (Intent intent : getRecentIntents(3)) {
                if (EXPLORING.contains(intent)) recentTopics.add(intent);
            }
            state = recentTopics.size() >= 2 ? ConversationState.COMPARING : ConversationState.INQUIRING;
        }
    }

    public ConversationState getState() {
        return state;
    }

    public void setState(ConversationState state) {
        this.state = state;
    }

    /** Moves to READY_TO_BOOK unless the guest is already booking or done. */
    public void markReadyToBook() {
        if (state != ConversationState.BOOKING && state != ConversationState.COMPLETED) {
            state = ConversationState.READY_TO_BOOK;
        }
    }

    /** Booking interest following a pricing or availability question. */
    public boolean isReadyToBook() {
        return intents.contains(Intent.BOOKING)
                && (intents.contains(Intent.PRICING) || intents.contains(Intent.AVAILABILITY));
    }

    /** Most recent intents, oldest first. */
    public List<Intent> getRecentIntents(int count) {
        List<Intent> all = new ArrayList<>(intents);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    public Optional<Intent> getLastIntent() {
        return Optional.ofNullable(intents.peekLast());
    }

    public void setPreference(String key, Object value) {
        preferences.put(key, value);
    }

    public Map<String, Object> getPreferences() {
        return Collections.unmodifiableMap(preferences);
    }

    public void addToSummary(String entry) {
        summary.add(entry);
        while (summary.size() > MAX_SUMMARY) summary.remove(0);
    }

    public List<String> getSummary() {
        return Collections.unmodifiableList(summary);
    }

    public void addKeyPoint(String point) {
        if (keyPoints.contains(point)) return;
        keyPoints.add(point);
        while (keyPoints.size() > MAX_KEY_POINTS) keyPoints.remove(0);
    }

    public List<String> getKeyPoints() {
        return Collections.unmodifiableList(keyPoints);
    }

    public void clear() {
        intents.clear();
        preferences.clear();
        summary.clear();
        keyPoints.clear();
        state = ConversationState.BROWSING;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("state", state.name());
        out.put("recent_intents", getRecentIntents(MAX_INTENTS).stream().map(Intent::key).toList());
        out.put("preferences", new LinkedHashMap<>(preferences));
        out.put("key_points", new ArrayList<>(keyPoints));
        return out;
    }
}
