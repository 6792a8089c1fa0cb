package com.ai.concierge.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls group sizes and cottage numbers out of guest text.
 * <p>
 * A number is a cottage number only when "cottage" sits just before it, and a
 * group size when guest words sit around it. Numbers that belong to a cottage
 * mention are never read as group sizes, so "cottage 9 for 4 guests" resolves
 * to cottage 9 and 4 guests.
 * </p>
 */
@Service
public class NumberExtractor {

    private static final Logger log = LoggerFactory.getLogger(NumberExtractor.class);

    static final int MIN_GROUP = 1;
    static final int MAX_GROUP = 50;
    static final int MIN_COTTAGE = 1;
    static final int MAX_COTTAGE = 20;
    static final int MAX_NIGHTS = 30;

    private static final String PEOPLE = "(?:members?|people|guests?|persons?|adults?|pax)";

    /** Ordered group-size patterns; the first valid hit wins. */
    private static final List<Pattern> GROUP_PATTERNS = List.of(
            Pattern.compile("\\b(?:we are|we're|group of|party of)\\s+(\\d+)\\s+" + PEOPLE + "\\b"),
            Pattern.compile("\\b(\\d+)\\s+" + PEOPLE + "\\b"),
            Pattern.compile("\\bwe are (?:a )?family of\\s+(\\d+)\\b"),
            Pattern.compile("\\bwe are (?:a )?(?:group|family) of\\s+(\\d+)\\b"),
            Pattern.compile("\\bwe are a group\\s+(\\d+)\\b"),
            Pattern.compile("\\b(?:we are|we're|group of|party of)\\s+(\\d+)\\b"),
            Pattern.compile("\\bgroup\\s+(\\d+)\\b"),
            Pattern.compile("\\bfamily of\\s+(\\d+)\\b"),
            Pattern.compile("\\b(\\d+)\\s+of us\\b"),
            Pattern.compile("\\bwe are\\s+(\\d+)\\s+(?:in which|where|of which)\\b"),
            Pattern.compile("\\bwith\\s+(\\d+)\\s+(?:" + PEOPLE + "|of us|friends|family members)\\b"),
            Pattern.compile("\\bfor\\s+(\\d+)\\b(?!\\s*(?:nights?|days?|weeks?|pm|am|bedrooms?|beds?|pkr|rs))"));

    private static final List<Pattern> NIGHT_PATTERNS = List.of(
            Pattern.compile("\\b(?:if\\s+)?stay(?:ing)?\\s+(?:for\\s+)?(\\d+)\\s+nights?\\b"),
            Pattern.compile("\\b(\\d+)\\s+nights?\\b"),
            Pattern.compile("\\b(\\d+)\\s+days?\\s+stay\\b"),
            Pattern.compile("\\bstay(?:ing)?\\s+(?:for\\s+)?(\\d+)\\s+days?\\b"));

    private static final Pattern CAPACITY_NUMBER = Pattern.compile(
            "\\b(?:accommodate|fit|suit|capacity|stay|book)\\b[^\\d]{0,20}(\\d+)\\b|\\b(\\d+)\\b[^\\d]{0,20}\\b(?:accommodate|fit|suit|capacity)\\b");

    private static final Pattern COTTAGE_MENTION = Pattern.compile(
            "\\bcottage\\s*(?:number|no\\.?|#)?\\s*(\\d+)\\b");

    private static final Pattern COTTAGE_WITH_DETERMINER = Pattern.compile(
            "\\b(?:this|that|the)\\s+cottage\\s*(?:number|no\\.?|#)?\\s*(\\d+)\\b");

    private static final Pattern BEDROOM_COTTAGE = Pattern.compile(
            "\\b(\\d+)\\s*-?\\s*(?:bedroom|bed)\\s+cottage\\b");

    private static final Pattern COTTAGE_NEAR_NUMBER = Pattern.compile("\\bcottage\\b[^\\d]{1,30}?(\\d+)\\b");

    private static final Pattern GROUP_INDICATOR = Pattern.compile(
            "\\b(?:people|persons?|guests?|members?|group|party|adults?)\\b");

    private static final Pattern CAPACITY_PHRASES = Pattern.compile(
            "\\b(?:will suit|is suitable|can accommodate|can fit|how many can|good for|right for|enough for|(?:which|what) cottage)\\b");

    private static final Pattern CAPACITY_KEYWORDS = Pattern.compile(
            "\\b(?:suit|suitable|suitability|accommodate|accommodation|fit|fitting|capacity|group size|how many can|can we|will it|good for|right for|enough for|best for)\\b");

    private static final Pattern STRICT_CAPACITY_KEYWORDS = Pattern.compile(
            "\\b(?:suit|suitable|suitability|accommodate|fit|fitting|capacity|group size|how many can|best for)\\b");

    private static final Pattern GENERAL_QUESTION = Pattern.compile(
            "\\b(?:tell me about|what is|what are|describe|information about|tell me)\\b");

    /** Night count in [1, 30] from "3 nights", "stay 2 days", "for 4 nights stay" and similar. */
    public Optional<Integer> extractNights(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String t = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : NIGHT_PATTERNS) {
            Matcher m = pattern.matcher(t);
            if (m.find()) {
                Integer value = parse(m.group(1));
                if (value != null && value >= 1 && value <= MAX_NIGHTS) return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** Group size in [1, 50], or empty. */
    public Optional<Integer> extractGroupSize(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String t = text.toLowerCase(Locale.ROOT);
        List<int[]> cottageSpans = cottageNumberSpans(t);

        for (Pattern pattern : GROUP_PATTERNS) {
            Matcher m = pattern.matcher(t);
            while (m.find()) {
                if (insideAny(m.start(1), cottageSpans)) continue;
                Integer value = parse(m.group(1));
                if (value != null && value >= MIN_GROUP && value <= MAX_GROUP) {
                    log.debug("Group size {} from pattern {}", value, pattern.pattern());
                    return Optional.of(value);
                }
            }
        }

        Matcher m = CAPACITY_NUMBER.matcher(t);
        while (m.find()) {
            int group = m.group(1) != null ? 1 : 2;
            if (insideAny(m.start(group), cottageSpans)) continue;
            Integer value = parse(m.group(group));
            if (value != null && value >= MIN_GROUP && value <= MAX_GROUP) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** First cottage number in [1, 20] named in the text, as a string ("9"). */
    public Optional<String> extractCottageNumber(String text) {
        List<String> all = extractCottageNumbers(text);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** Every distinct cottage number named in the text, in order of appearance. */
    public List<String> extractCottageNumbers(String text) {
        if (StringUtils.isBlank(text)) return List.of();
        String t = text.toLowerCase(Locale.ROOT);
        Set<String> found = new LinkedHashSet<>();

        for (Pattern pattern : List.of(COTTAGE_WITH_DETERMINER, COTTAGE_MENTION, BEDROOM_COTTAGE)) {
            Matcher m = pattern.matcher(t);
            while (m.find()) {
                Integer value = parse(m.group(1));
                if (value != null && value >= MIN_COTTAGE && value <= MAX_COTTAGE) {
                    found.add(String.valueOf(value));
                }
            }
        }
        if (!found.isEmpty()) return new ArrayList<>(found);

        Matcher near = COTTAGE_NEAR_NUMBER.matcher(t);
        if (near.find()) {
            String between = t.substring(near.start(), near.start(1));
            String after = t.substring(near.end(1), Math.min(t.length(), near.end(1) + 15));
            if (GROUP_INDICATOR.matcher(between).find() || GROUP_INDICATOR.matcher(after).find()) {
                return List.of();
            }
            Integer value = parse(near.group(1));
            if (value != null && value >= MIN_COTTAGE && value <= MAX_COTTAGE) {
                return List.of(String.valueOf(value));
            }
        }
        return List.of();
    }

    /**
     * True when the guest asks whether a cottage suits a group. General
     * "tell me about" questions only count when they also carry a group size
     * or a "which cottage"/"best for" phrasing.
     */
    public boolean isCapacityQuery(String text) {
        if (StringUtils.isBlank(text)) return false;
        String t = text.toLowerCase(Locale.ROOT);
        boolean hasGroup = extractGroupSize(t).isPresent();

        if (GENERAL_QUESTION.matcher(t).find()) {
            boolean whichCottage = t.contains("which cottage") || t.contains("what cottage");
            return (hasGroup && CAPACITY_KEYWORDS.matcher(t).find())
                    || whichCottage
                    || t.contains("best for")
                    || (hasGroup && GROUP_INDICATOR.matcher(t).find() && CAPACITY_PHRASES.matcher(t).find());
        }
        if (CAPACITY_PHRASES.matcher(t).find()) return true;
        if (STRICT_CAPACITY_KEYWORDS.matcher(t).find()) return true;
        // "can we", "will it" and friends only count next to a group size
        return hasGroup && CAPACITY_KEYWORDS.matcher(t).find();
    }

    private static List<int[]> cottageNumberSpans(String t) {
        List<int[]> spans = new ArrayList<>();
        Matcher m = COTTAGE_MENTION.matcher(t);
        while (m.find()) {
            spans.add(new int[]{m.start(1), m.end(1)});
        }
        return spans;
    }

    private static boolean insideAny(int index, List<int[]> spans) {
        for (int[] span : spans) {
            if (index >= span[0] && index < span[1]) return true;
        }
        return false;
    }

    private static Integer parse(String digits) {
        if (digits == null) return null;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
