package com.ai.concierge.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Per-session slot state. Values are validated before they are stored and stay
 * until a newly extracted value replaces them or the slots are cleared.
 * <p>
 * Also keeps the last cottage the guest mentioned. That pointer is only a hint:
 * {@link #shouldUseCurrentCottage(String, Intent)} decides whether a turn may
 * lean on it.
 * </p>
 */
public class SlotManager {

    private static final Logger log = LoggerFactory.getLogger(SlotManager.class);

    private static final Pattern EXPLICIT_COTTAGE = Pattern.compile("\\bcottage\\s*(?:number|no\\.?|#)?\\s*\\d+\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern COTTAGE_REFERENCE = Pattern.compile(
            "\\b(?:this|that|the same|same)\\s+(?:cottage|one|place)\\b|\\bit\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern GENERAL_INFO = Pattern.compile(
            "^\\s*(?:what is|what are|what's|tell me about|tell me more about|is there|are there|describe|do you have|does it have)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SPECIFIC_CALCULATION = Pattern.compile(
            "\\b(?:price|prices|pricing|cost|costs|rate|rates|charges?|how much|total|book|booking|reserve|reservation"
                    + "|nights?|days?|check-?in|check-?out|available|availability"
                    + "|\\d+\\s*(?:guests?|people|persons?|members?|adults?)"
                    + "|jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec"
                    + "|january|february|march|april|june|july|august|september|october|november|december"
                    + "|weekdays?|weekends?)\\b",
            Pattern.CASE_INSENSITIVE);

    private final SlotDefinitions definitions;
    private final Map<SlotName, Object> slots = new EnumMap<>(SlotName.class);
    private final List<SlotChange> history = new ArrayList<>();
    private String currentCottage;

    public SlotManager(SlotDefinitions definitions) {
        this.definitions = definitions;
    }

    /**
     * Validates and stores each extracted value. Invalid values are logged and
     * dropped without touching the stored value.
     *
     * @return slots whose stored value changed
     */
    public List<SlotName> updateSlots(Map<SlotName, Object> extracted) {
        if (extracted == null || extracted.isEmpty()) return List.of();
        List<SlotName> changed = new ArrayList<>();
        for (Map.Entry<SlotName, Object> entry : extracted.entrySet()) {
            SlotName name = entry.getKey();
            Object value = entry.getValue();
            if (value == null) continue;
            SlotDefinition definition = definitions.get(name);
            if (!definition.isValid(value)) {
                log.warn("Discarding invalid value '{}' for slot {}", value, name.key());
                continue;
            }
            Object previous = slots.put(name, value);
            if (!Objects.equals(previous, value)) {
                history.add(new SlotChange(name, previous, value));
                changed.add(name);
                log.debug("Slot {} updated: {} -> {}", name.key(), previous, value);
            }
            if (name == SlotName.COTTAGE_ID && !SlotDefinitions.ANY_COTTAGE.equals(value)) {
                currentCottage = (String) value;
            }
        }
        // a night count belongs to the dates it came with
        if (changed.contains(SlotName.DATES) && !extracted.containsKey(SlotName.NIGHTS) && slots.containsKey(SlotName.NIGHTS)) {
            Object stale = slots.remove(SlotName.NIGHTS);
            history.add(new SlotChange(SlotName.NIGHTS, stale, null));
            changed.add(SlotName.NIGHTS);
            log.debug("Slot {} cleared by new dates (was {})", SlotName.NIGHTS.key(), stale);
        }
        return changed;
    }

    /** Stores one value after validation. */
    public boolean setSlot(SlotName name, Object value) {
        if (value == null) return false;
        updateSlots(Map.of(name, value));
        return Objects.equals(slots.get(name), value);
    }

    public Object getSlot(SlotName name) {
        return slots.get(name);
    }

    public boolean hasSlot(SlotName name) {
        return slots.containsKey(name);
    }

    public Optional<Integer> getInt(SlotName name) {
        return slots.get(name) instanceof Integer n ? Optional.of(n) : Optional.empty();
    }

    public Optional<String> getString(SlotName name) {
        return slots.get(name) instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<DateRange> getDates() {
        return slots.get(SlotName.DATES) instanceof DateRange r ? Optional.of(r) : Optional.empty();
    }

    public Map<SlotName, Object> getSlots() {
        return Collections.unmodifiableMap(new EnumMap<>(slots));
    }

    public List<SlotDefinition> getRequiredSlots(Intent intent) {
        return definitions.all().stream()
                .filter(d -> d.isRequiredFor(intent))
                .sorted(Comparator.comparingInt(SlotDefinition::priority))
                .toList();
    }

    /** Required slots for the intent that hold no valid value yet, highest priority first. */
    public List<SlotName> getMissingSlots(Intent intent) {
        return getRequiredSlots(intent).stream()
                .map(SlotDefinition::name)
                .filter(name -> !slots.containsKey(name))
                .toList();
    }

    /** At least two of guests, dates and cottage are known. */
    public boolean hasEnoughBookingInfo() {
        int known = 0;
        if (slots.containsKey(SlotName.GUESTS)) known++;
        if (slots.containsKey(SlotName.DATES)) known++;
        if (slots.containsKey(SlotName.COTTAGE_ID)) known++;
        return known >= 2;
    }

    public void clearSlots() {
        slots.clear();
        history.clear();
        currentCottage = null;
    }

    public List<SlotChange> getSlotHistory() {
        return Collections.unmodifiableList(history);
    }

    public Optional<String> getCurrentCottage() {
        return Optional.ofNullable(currentCottage);
    }

    /** Records the most recently mentioned cottage without touching the cottage slot. */
    public void noteCottageMention(String cottage) {
        if (cottage != null && definitions.get(SlotName.COTTAGE_ID).isValid(cottage)) {
            currentCottage = cottage;
        }
    }

    /**
     * Whether this turn may use the remembered cottage: the query names a
     * cottage itself, or the intent needs a cottage and the query is a
     * specific calculation rather than a general information question.
     */
    public boolean shouldUseCurrentCottage(String query, Intent intent) {
        if (query == null) return false;
        if (EXPLICIT_COTTAGE.matcher(query).find()) return true;
        boolean needsCottage = definitions.get(SlotName.COTTAGE_ID).isRequiredFor(intent);
        return needsCottage && isSpecificCalculation(query) && !isGeneralInfo(query);
    }

    /** True when the query refers back to "this/that cottage" or "it". */
    public static boolean refersToCottage(String query) {
        return query != null && COTTAGE_REFERENCE.matcher(query).find();
    }

    public static boolean isSpecificCalculation(String query) {
        return query != null && SPECIFIC_CALCULATION.matcher(query).find();
    }

    public static boolean isGeneralInfo(String query) {
        return query != null && GENERAL_INFO.matcher(query.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Slot values to use for one turn. The cottage is taken from the query when
     * it names one, otherwise from the remembered cottage when the guard allows,
     * otherwise left out.
     */
    public Map<SlotName, Object> slotsForTurn(String query, Intent intent, Optional<String> namedCottage) {
        Map<SlotName, Object> view = new EnumMap<>(slots);
        view.remove(SlotName.COTTAGE_ID);
        if (namedCottage.isPresent()) {
            view.put(SlotName.COTTAGE_ID, namedCottage.get());
        } else if (shouldUseCurrentCottage(query, intent)) {
            Object cottage = currentCottage != null ? currentCottage : slots.get(SlotName.COTTAGE_ID);
            if (cottage != null) view.put(SlotName.COTTAGE_ID, cottage);
        }
        return view;
    }

    /** Slot values keyed by wire name, for persistence and responses. */
    public Map<String, Object> toKeyMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        slots.forEach((name, value) -> out.put(name.key(), value));
        return out;
    }

    public record SlotChange(SlotName slot, Object previous, Object current) {
    }
}
