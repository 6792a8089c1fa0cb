package com.ai.concierge.conversation;

import com.ai.concierge.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SlotManagerTest {

    private SlotManager slots;

    @BeforeEach
    void setUp() {
        slots = new SlotManager(new SlotDefinitions(TestFixtures.properties()));
    }

    @Test
    void missingSlotsShrinkAsValidValuesArrive() {
        assertEquals(List.of(SlotName.GUESTS, SlotName.COTTAGE_ID, SlotName.DATES, SlotName.NIGHTS, SlotName.SEASON),
                slots.getMissingSlots(Intent.PRICING));

        slots.updateSlots(Map.of(SlotName.GUESTS, 4, SlotName.COTTAGE_ID, "9"));

        assertEquals(List.of(SlotName.DATES, SlotName.NIGHTS, SlotName.SEASON), slots.getMissingSlots(Intent.PRICING));
        assertTrue(slots.getMissingSlots(Intent.SAFETY).isEmpty());
    }

    @Test
    void invalidValuesAreDropped() {
        List<SlotName> changed = slots.updateSlots(Map.of(
                SlotName.GUESTS, 40,
                SlotName.COTTAGE_ID, "12",
                SlotName.SEASON, "monsoon"));

        assertTrue(changed.isEmpty());
        assertFalse(slots.hasSlot(SlotName.GUESTS));
        assertFalse(slots.hasSlot(SlotName.COTTAGE_ID));
        assertFalse(slots.setSlot(SlotName.NIGHTS, 0));
        assertFalse(slots.setSlot(SlotName.NIGHTS, null));
    }

    @Test
    void invalidValueKeepsPreviousOne() {
        slots.setSlot(SlotName.GUESTS, 5);
        slots.setSlot(SlotName.GUESTS, 100);

        assertEquals(Optional.of(5), slots.getInt(SlotName.GUESTS));
    }

    @Test
    void repeatingTheSameUpdateChangesNothing() {
        Map<SlotName, Object> update = Map.of(SlotName.GUESTS, 4, SlotName.COTTAGE_ID, "11");

        assertEquals(2, slots.updateSlots(update).size());
        Map<SlotName, Object> before = slots.getSlots();

        assertTrue(slots.updateSlots(update).isEmpty());
        assertEquals(before, slots.getSlots());
        assertEquals(2, slots.getSlotHistory().size());
    }

    @Test
    void newDatesDropNightCountFromEarlierTurn() {
        slots.setSlot(SlotName.NIGHTS, 3);

        List<SlotName> changed = slots.updateSlots(Map.of(
                SlotName.DATES, DateRange.of(LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 5))));

        assertFalse(slots.hasSlot(SlotName.NIGHTS));
        assertTrue(changed.contains(SlotName.NIGHTS));
        SlotManager.SlotChange last = slots.getSlotHistory().get(slots.getSlotHistory().size() - 1);
        assertEquals(3, last.previous());
        assertNull(last.current());
    }

    @Test
    void nightCountGivenWithDatesIsKept() {
        slots.updateSlots(Map.of(
                SlotName.DATES, DateRange.of(LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 5)),
                SlotName.NIGHTS, 2));

        assertEquals(Optional.of(2), slots.getInt(SlotName.NIGHTS));
    }

    @Test
    void enoughBookingInfoNeedsTwoOfThree() {
        slots.setSlot(SlotName.GUESTS, 4);
        assertFalse(slots.hasEnoughBookingInfo());

        slots.setSlot(SlotName.DATES, DateRange.of(LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 5)));
        assertTrue(slots.hasEnoughBookingInfo());
    }

    @Test
    void rememberedCottageDoesNotLeakIntoUnrelatedTopic() {
        slots.noteCottageMention("9");

        Map<SlotName, Object> safety = slots.slotsForTurn("is it safe", Intent.SAFETY, Optional.empty());
        assertFalse(safety.containsKey(SlotName.COTTAGE_ID));

        Map<SlotName, Object> pricing = slots.slotsForTurn("how much for 2 nights", Intent.PRICING, Optional.empty());
        assertEquals("9", pricing.get(SlotName.COTTAGE_ID));
    }

    @Test
    void generalQuestionDoesNotUseRememberedCottage() {
        slots.setSlot(SlotName.COTTAGE_ID, "11");

        Map<SlotName, Object> view = slots.slotsForTurn("what is the price range", Intent.PRICING, Optional.empty());

        assertFalse(view.containsKey(SlotName.COTTAGE_ID));
        assertEquals(Optional.of("11"), slots.getCurrentCottage());
    }

    @Test
    void namedCottageWinsForTheTurn() {
        slots.setSlot(SlotName.COTTAGE_ID, "11");

        Map<SlotName, Object> view = slots.slotsForTurn("and cottage 7?", Intent.ROOMS, Optional.of("7"));

        assertEquals("7", view.get(SlotName.COTTAGE_ID));
        assertEquals("11", slots.getSlot(SlotName.COTTAGE_ID));
    }

    @Test
    void clearForgetsEverything() {
        slots.setSlot(SlotName.GUESTS, 4);
        slots.noteCottageMention("9");

        slots.clearSlots();

        assertTrue(slots.getSlots().isEmpty());
        assertTrue(slots.getCurrentCottage().isEmpty());
        assertTrue(slots.getSlotHistory().isEmpty());
    }

    @Test
    void queryShapeHelpers() {
        assertTrue(SlotManager.refersToCottage("does that cottage have wifi"));
        assertTrue(SlotManager.isSpecificCalculation("price for 4 guests"));
        assertTrue(SlotManager.isGeneralInfo("Tell me about the cottages"));
        assertFalse(SlotManager.isGeneralInfo("how much is it"));
    }

    @Test
    void keyMapUsesWireNames() {
        slots.setSlot(SlotName.COTTAGE_ID, "9");
        slots.setSlot(SlotName.FAMILY, true);

        assertEquals(Map.of("cottage_id", "9", "family", true), slots.toKeyMap());
    }
}
