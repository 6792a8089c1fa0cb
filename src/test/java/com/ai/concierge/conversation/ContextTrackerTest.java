package com.ai.concierge.conversation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextTrackerTest {

    private final ContextTracker context = new ContextTracker();

    @Test
    void statesFollowIntents() {
        assertEquals(ConversationState.BROWSING, context.getState());

        context.addIntent(Intent.PRICING);
        assertEquals(ConversationState.INQUIRING, context.getState());

        context.addIntent(Intent.ROOMS);
        assertEquals(ConversationState.COMPARING, context.getState());

        context.addIntent(Intent.BOOKING);
        assertEquals(ConversationState.BOOKING, context.getState());
    }

    @Test
    void bookingAfterPricingIsReadyToBook() {
        context.addIntent(Intent.FACILITIES);
        context.addIntent(Intent.BOOKING);
        assertFalse(context.isReadyToBook());

        context.addIntent(Intent.PRICING);
        assertTrue(context.isReadyToBook());
    }

    @Test
    void markReadyToBookDoesNotDemoteBooking() {
        context.addIntent(Intent.PRICING);
        context.markReadyToBook();
        assertEquals(ConversationState.READY_TO_BOOK, context.getState());

        context.addIntent(Intent.BOOKING);
        context.markReadyToBook();
        assertEquals(ConversationState.BOOKING, context.getState());
    }

    @Test
    void keepsTheLastTenIntents() {
        for (int i = 0; i < 12; i++) context.addIntent(Intent.SAFETY);
        context.addIntent(Intent.LOCATION);

        List<Intent> recent = context.getRecentIntents(20);
        assertEquals(10, recent.size());
        assertEquals(Intent.LOCATION, recent.get(recent.size() - 1));
        assertEquals(List.of(Intent.SAFETY, Intent.LOCATION), context.getRecentIntents(2));
    }

    @Test
    void keyPointsKeepTheMostRecent() {
        for (int i = 0; i < 30; i++) {
            context.addKeyPoint("Quoted total " + i);
        }

        assertEquals(20, context.getKeyPoints().size());
        assertEquals("Quoted total 10", context.getKeyPoints().get(0));
        assertEquals("Quoted total 29", context.getKeyPoints().get(19));
    }

    @Test
    void summaryIsBoundedAndKeyPointsAreUnique() {
        for (int i = 0; i < 25; i++) context.addToSummary("turn " + i);
        context.addKeyPoint("Quoted cottage 9");
        context.addKeyPoint("Quoted cottage 9");

        assertEquals(20, context.getSummary().size());
        assertEquals("turn 5", context.getSummary().get(0));
        assertEquals(List.of("Quoted cottage 9"), context.getKeyPoints());
    }

    @Test
    void clearResetsEverything() {
        context.addIntent(Intent.BOOKING);
        context.setPreference("cottage_id", "9");

        context.clear();

        assertEquals(ConversationState.BROWSING, context.getState());
        assertTrue(context.getRecentIntents(5).isEmpty());
        assertEquals(Map.of(), context.getPreferences());
        assertEquals("BROWSING", context.toMap().get("state"));
    }
}
