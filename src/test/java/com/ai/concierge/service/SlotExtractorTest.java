package com.ai.concierge.service;

import com.ai.concierge.TestFixtures;
import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionFailure;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.Intent;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotManager;
import com.ai.concierge.conversation.SlotName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlotExtractorTest {

    private CompletionClient completion;
    private SlotExtractor extractor;
    private SlotManager current;

    @BeforeEach
    void setUp() {
        completion = mock(CompletionClient.class);
        extractor = new SlotExtractor(new NumberExtractor(), new DateExtractor(TestFixtures.CLOCK), completion,
                TestFixtures.properties());
        current = new SlotManager(new SlotDefinitions(TestFixtures.properties()));
    }

    @Test
    void patternsFillGuestsCottageAndDates() {
        Map<SlotName, Object> slots = extractor.extractSlots(
                "price for 4 guests in cottage 9 from 3 feb to 5 feb", Intent.PRICING, current);

        assertEquals(4, slots.get(SlotName.GUESTS));
        assertEquals("9", slots.get(SlotName.COTTAGE_ID));
        assertEquals(DateRange.of(LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 5)), slots.get(SlotName.DATES));
        verify(completion, never()).generate(anyString(), anyInt());
    }

    @Test
    void heldValuesOnlyChangeOnSpecificCalculations() {
        current.updateSlots(Map.of(SlotName.COTTAGE_ID, "9"));

        assertFalse(extractor.extractSlots("tell me about cottage 11", Intent.ROOMS, current)
                .containsKey(SlotName.COTTAGE_ID));

        Map<SlotName, Object> switched = extractor.extractSlots("price of cottage 11 for 2 nights", Intent.PRICING, current);
        assertEquals("11", switched.get(SlotName.COTTAGE_ID));
        assertEquals(2, switched.get(SlotName.NIGHTS));
    }

    @Test
    void completionFillsGapsWithValidatedValues() {
        when(completion.isConfigured()).thenReturn(true);
        when(completion.generate(anyString(), anyInt())).thenReturn(CompletionResult.success(
                "Here you go: {\"guests\": 5, \"cottage_id\": \"cottage_11\", "
                        + "\"dates\": {\"start\": \"2026-03-01\", \"end\": \"2026-03-04\"}, "
                        + "\"family\": false, \"season\": \"Peak\"}"));

        Map<SlotName, Object> slots = extractor.extractSlots("what about for my family", Intent.ROOMS, current);

        assertEquals(5, slots.get(SlotName.GUESTS));
        assertEquals("11", slots.get(SlotName.COTTAGE_ID));
        assertEquals(DateRange.of(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 4)), slots.get(SlotName.DATES));
        assertEquals(true, slots.get(SlotName.FAMILY), "pattern value wins over the completion guess");
        assertEquals("peak", slots.get(SlotName.SEASON));
    }

    @Test
    void implausibleCompletionValuesAreDropped() {
        when(completion.isConfigured()).thenReturn(true);
        when(completion.generate(anyString(), anyInt())).thenReturn(CompletionResult.success(
                "{\"guests\": 500, \"cottage_id\": \"99\", \"season\": \"monsoon\", "
                        + "\"dates\": {\"start\": \"2020-01-01\", \"end\": \"2020-01-02\"}}"));

        assertTrue(extractor.extractSlots("is it nice there", Intent.FACILITIES, current).isEmpty());
    }

    @Test
    void completionFailureOrGarbageYieldsNothing() {
        when(completion.isConfigured()).thenReturn(true);
        when(completion.generate(anyString(), anyInt()))
                .thenReturn(CompletionResult.failure(CompletionFailure.TRANSPORT, "connection refused"))
                .thenReturn(CompletionResult.success("I think they want cottage 9"))
                .thenReturn(CompletionResult.success("{guests: five"));

        assertTrue(extractor.extractSlots("is it nice there", Intent.FACILITIES, current).isEmpty());
        assertTrue(extractor.extractSlots("is it nice there", Intent.FACILITIES, current).isEmpty());
        assertTrue(extractor.extractSlots("is it nice there", Intent.FACILITIES, current).isEmpty());
    }

    @Test
    void completionNotAskedOutsideTopicQuestions() {
        when(completion.isConfigured()).thenReturn(true);

        extractor.extractSlots("is it nice there", Intent.FAQ_QUESTION, current);

        verify(completion, never()).generate(anyString(), anyInt());
    }

    @Test
    void familyAndSeasonWords() {
        assertEquals(Optional.of(true), SlotExtractor.familyFlag("we are 4 people in which 2 are children"));
        assertEquals(Optional.of(false), SlotExtractor.familyFlag("a trip with friends"));
        assertEquals(Optional.empty(), SlotExtractor.familyFlag("just me"));

        assertEquals(Optional.of("off-peak"), SlotExtractor.season("any off-peak discount?"));
        assertEquals(Optional.of("weekday"), SlotExtractor.season("coming on weekdays"));
        assertEquals(Optional.of("weekend"), SlotExtractor.season("this weekend"));
        assertEquals(Optional.empty(), SlotExtractor.season("in march"));
    }
}
