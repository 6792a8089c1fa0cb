package com.ai.concierge.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NumberExtractorTest {

    private final NumberExtractor extractor = new NumberExtractor();

    @Test
    void cottageNumberIsNeverAGroupSize() {
        String q = "cottage 9 for 4 guests";

        assertEquals(Optional.of(4), extractor.extractGroupSize(q));
        assertEquals(Optional.of("9"), extractor.extractCottageNumber(q));
    }

    @Test
    void groupSizeAndCottageInOneSentence() {
        String q = "we have 4 people, tell me about cottage 9";

        assertEquals(Optional.of(4), extractor.extractGroupSize(q));
        assertEquals(Optional.of("9"), extractor.extractCottageNumber(q));
        assertFalse(extractor.isCapacityQuery(q));
    }

    @Test
    void groupPhrasings() {
        assertEquals(Optional.of(6), extractor.extractGroupSize("We are 6 members"));
        assertEquals(Optional.of(5), extractor.extractGroupSize("we are a family of 5"));
        assertEquals(Optional.of(3), extractor.extractGroupSize("there are 3 of us"));
        assertEquals(Optional.of(8), extractor.extractGroupSize("will it accommodate 8"));
    }

    @Test
    void nightsAreNotGroupSizes() {
        assertTrue(extractor.extractGroupSize("price for 3 nights").isEmpty());
        assertTrue(extractor.extractGroupSize("cottage 9").isEmpty());
    }

    @Test
    void groupSizeOutsideRangeIsIgnored() {
        assertTrue(extractor.extractGroupSize("we are 80 people").isEmpty());
    }

    @Test
    void nights() {
        assertEquals(Optional.of(3), extractor.extractNights("cottage 7 for 3 nights"));
        assertEquals(Optional.of(2), extractor.extractNights("if we stay 2 days"));
        assertTrue(extractor.extractNights("stay for 45 nights").isEmpty());
        assertTrue(extractor.extractNights("how much is it").isEmpty());
    }

    @Test
    void everyNamedCottageInOrder() {
        assertEquals(List.of("9", "11"), extractor.extractCottageNumbers("compare cottage 9 and cottage 11"));
        assertEquals(List.of("7"), extractor.extractCottageNumbers("is cottage no. 7 available"));
        assertTrue(extractor.extractCottageNumbers("what are the facilities").isEmpty());
    }

    @Test
    void cottageFollowedByGuestWordsIsNotACottageNumber() {
        assertTrue(extractor.extractCottageNumber("which cottage is best for 6 people").isEmpty());
    }

    @Test
    void capacityQueries() {
        assertTrue(extractor.isCapacityQuery("is cottage 9 suitable for 6 people"));
        assertTrue(extractor.isCapacityQuery("which cottage is best for a family"));
        assertTrue(extractor.isCapacityQuery("can we fit 8 guests"));
        assertFalse(extractor.isCapacityQuery("tell me about cottage 11"));
        assertFalse(extractor.isCapacityQuery("what is the price"));
    }
}
