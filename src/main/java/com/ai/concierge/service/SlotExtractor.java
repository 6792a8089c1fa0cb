package com.ai.concierge.service;

import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.Intent;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotManager;
import com.ai.concierge.conversation.SlotName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls slot values out of a guest message.
 * <p>
 * Patterns run first. A value already held by the session is only replaced
 * when the message is a specific calculation ("cottage 11 for 3 nights"),
 * which is how a guest switches cottage or dates. When patterns find fewer
 * than two values for an information question, the completion service is
 * asked for a JSON guess whose every field is parsed again here before use.
 * </p>
 */
@Service
public class SlotExtractor {

    private static final Logger log = LoggerFactory.getLogger(SlotExtractor.class);

    private static final Pattern CHILDREN_AMONG = Pattern.compile("\\bin\\s+which\\s+\\d+\\s+are\\s+(?:children|kids|child)\\b");
    private static final Pattern FAMILY = Pattern.compile("\\b(?:family|families|with kids|children|kids|child)\\b");
    private static final Pattern FRIENDS = Pattern.compile("\\b(?:friends|colleagues|group)\\b");

    private static final Pattern OFF_PEAK = Pattern.compile("\\boff[- ]?peak\\b");
    private static final Pattern PEAK = Pattern.compile("\\bpeak\\b");
    private static final Pattern WEEKDAY = Pattern.compile("\\bweek\\s?days?\\b");
    private static final Pattern WEEKEND = Pattern.compile("\\bweek\\s?ends?\\b");

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final Pattern LEGACY_COTTAGE = Pattern.compile("^cottage[_ ]?(\\d+)$");

    private final NumberExtractor numberExtractor;
    private final DateExtractor dateExtractor;
    private final CompletionClient completionClient;
    private final int slotMaxTokens;
    private final ObjectMapper mapper = new ObjectMapper();

    public SlotExtractor(NumberExtractor numberExtractor,
                         DateExtractor dateExtractor,
                         CompletionClient completionClient,
                         ConciergeProperties properties) {
        this.numberExtractor = numberExtractor;
        this.dateExtractor = dateExtractor;
        this.completionClient = completionClient;
        this.slotMaxTokens = properties.getCompletion().getSlotMaxTokens();
    }

    /**
     * Candidate values for the session. Nothing is stored here; the caller
     * passes the result to {@link SlotManager#updateSlots(Map)}, which validates.
     */
    public Map<SlotName, Object> extractSlots(String query, Intent intent, SlotManager current) {
        Map<SlotName, Object> extracted = new EnumMap<>(SlotName.class);
        if (StringUtils.isBlank(query)) return extracted;
        String q = query.toLowerCase(Locale.ROOT);
        boolean overwrite = SlotManager.isSpecificCalculation(q);

        if (open(SlotName.GUESTS, current, overwrite)) {
            numberExtractor.extractGroupSize(q).ifPresent(g -> extracted.put(SlotName.GUESTS, g));
        }
        if (open(SlotName.COTTAGE_ID, current, overwrite)) {
            numberExtractor.extractCottageNumber(q).ifPresent(c -> extracted.put(SlotName.COTTAGE_ID, c));
        }
        if (open(SlotName.DATES, current, overwrite)) {
            dateExtractor.extractDateRange(q).ifPresent(d -> extracted.put(SlotName.DATES, d));
        }
        if (open(SlotName.NIGHTS, current, overwrite)) {
            numberExtractor.extractNights(q).ifPresent(n -> extracted.put(SlotName.NIGHTS, n));
        }
        if (open(SlotName.FAMILY, current, overwrite)) {
            familyFlag(q).ifPresent(f -> extracted.put(SlotName.FAMILY, f));
        }
        if (open(SlotName.SEASON, current, overwrite)) {
            season(q).ifPresent(s -> extracted.put(SlotName.SEASON, s));
        }

        if (extracted.size() < 2 && intent != null && intent.isTopic() && completionClient.isConfigured()) {
            extractWithCompletion(query, intent).forEach((name, value) -> {
                if (!extracted.containsKey(name) && open(name, current, overwrite)) {
                    extracted.put(name, value);
                }
            });
        }
        if (!extracted.isEmpty()) {
            log.debug("Extracted slots {} from '{}'", extracted.keySet(), query);
        }
        return extracted;
    }

    static Optional<Boolean> familyFlag(String q) {
        if (CHILDREN_AMONG.matcher(q).find() || FAMILY.matcher(q).find()) return Optional.of(true);
        if (FRIENDS.matcher(q).find()) return Optional.of(false);
        return Optional.empty();
    }

    static Optional<String> season(String q) {
        if (OFF_PEAK.matcher(q).find()) return Optional.of("off-peak");
        if (WEEKDAY.matcher(q).find()) return Optional.of("weekday");
        if (WEEKEND.matcher(q).find()) return Optional.of("weekend");
        if (PEAK.matcher(q).find()) return Optional.of("peak");
        return Optional.empty();
    }

    /** Completion-service guess, reduced to values our own parsers accept. */
    Map<SlotName, Object> extractWithCompletion(String query, Intent intent) {
        Map<SlotName, Object> out = new EnumMap<>(SlotName.class);
        String prompt = """
                Extract relevant information from the user query for a Swiss Cottages booking system.

                User query: "%s"
                Detected intent: %s

                Respond in JSON with only the fields that are explicitly mentioned:
                {"guests": <integer or null>, "cottage_id": "<7|9|11|any|null>",
                 "dates": {"start": "<YYYY-MM-DD>", "end": "<YYYY-MM-DD>"} or null,
                 "family": <true|false|null>, "season": "<weekday|weekend|peak|off-peak|null>"}

                Return null for fields not mentioned."""
                .formatted(query, intent.key());

        CompletionResult result = completionClient.generate(prompt, slotMaxTokens);
        if (!result.success()) {
            log.warn("Slot extraction fallback failed ({}): {}", result.failure(), result.message());
            return out;
        }
        Matcher json = JSON_OBJECT.matcher(result.textOrEmpty());
        if (!json.find()) {
            log.debug("Slot extraction reply has no JSON object: {}", result.text());
            return out;
        }
        JsonNode root;
        try {
            root = mapper.readTree(json.group());
        } catch (JsonProcessingException e) {
            log.warn("Slot extraction reply is not valid JSON: {}", e.getOriginalMessage());
            return out;
        }

        text(root, "guests")
                .flatMap(g -> numberExtractor.extractGroupSize(g + " guests"))
                .ifPresent(g -> out.put(SlotName.GUESTS, g));
        text(root, "cottage_id").or(() -> text(root, "room_type"))
                .flatMap(this::cottageValue)
                .ifPresent(c -> out.put(SlotName.COTTAGE_ID, c));
        JsonNode dates = root.path("dates");
        if (dates.isObject()) {
            Optional<LocalDate> start = text(dates, "start").flatMap(dateExtractor::parseDateString);
            Optional<LocalDate> end = text(dates, "end").flatMap(dateExtractor::parseDateString);
            if (start.isPresent() && end.isPresent()) {
                DateRange range = DateRange.of(start.get(), end.get());
                if (dateExtractor.validateDateRange(range).valid()) {
                    out.put(SlotName.DATES, range);
                }
            }
        }
        if (root.path("family").isBoolean()) {
            out.put(SlotName.FAMILY, root.path("family").booleanValue());
        }
        text(root, "season")
                .map(s -> s.toLowerCase(Locale.ROOT))
                .filter(SlotDefinitions.SEASONS::contains)
                .ifPresent(s -> out.put(SlotName.SEASON, s));
        return out;
    }

    private Optional<String> cottageValue(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (SlotDefinitions.ANY_COTTAGE.equals(value)) return Optional.of(value);
        Matcher legacy = LEGACY_COTTAGE.matcher(value);
        if (legacy.matches()) value = legacy.group(1);
        return numberExtractor.extractCottageNumber("cottage " + value);
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return Optional.empty();
        String text = value.asText();
        return StringUtils.isBlank(text) || "null".equalsIgnoreCase(text) ? Optional.empty() : Optional.of(text);
    }

    private static boolean open(SlotName name, SlotManager current, boolean overwrite) {
        return current == null || overwrite || !current.hasSlot(name);
    }
}
