package com.ai.concierge.service;

import com.ai.concierge.conversation.Intent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword detection of what an information question is about.
 */
@Service
public class TopicDetector {

    private static final Pattern PRICING_EXCLUSIONS = Pattern.compile(
            "\\b(?:golf (?:rates?|course|package)|occupancy rates?|capacity rates?|exchange rates?|interest rates?|discount rates?)\\b");

    private static final Pattern PRICING_PRIMARY = Pattern.compile(
            "\\b(?:price|prices|pricing|priced|cost|costs|costing|how much|pkr|per night|weekdays?|weekends?|week day|week end"
                    + "|tariffs?|charges?|rent)\\b");

    private static final Pattern PRICING_PHRASES = Pattern.compile(
            "\\bwhat\\s+(?:will\\s+be|is)\\s+(?:the\\s+)?(?:price|cost|rate)\\b"
                    + "|\\btell\\s+me\\s+(?:the\\s+)?(?:price|cost|rate)\\b"
                    + "|\\bhow\\s+much\\s+(?:will\\s+it\\s+be|is\\s+it|does\\s+it\\s+cost)\\b");

    private static final Pattern RATE = Pattern.compile("\\brates?\\b");

    private static final Pattern RATE_CONTEXT = Pattern.compile(
            "\\b(?:cottages?|booking|stay|nights?|per night|weekdays?|weekends?|guests?|accommodation)\\b");

    private static final String MONTH = "(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec|january|february|march|april|june|july|august|september|october|november|december)";

    private static final Pattern DATE_RANGE_STAY = Pattern.compile(
            "\\b(?:from\\s+)?\\d+\\s+" + MONTH + "\\s+to\\s+\\d+");

    private static final Pattern BOOKING = Pattern.compile(
            "\\b(?:book|booking|reserve|reservation|reserving|advance payment|cancel(?:lation)?|refund|check-?in|check-?out)\\b");

    private static final Pattern AVAILABILITY = Pattern.compile(
            "\\b(?:available|availability|vacancy|vacant|free on|open on|fully booked)\\b");

    private static final Pattern SAFETY = Pattern.compile(
            "\\b(?:safe|safety|secure|security|guards?|gated|cctv|dangerous|risk)\\b");

    private static final Pattern LOCATION = Pattern.compile(
            "\\b(?:location|located|where|address|directions?|nearby|near|distance|how far|attractions?|route|map|reach)\\b");

    private static final Pattern FACILITIES = Pattern.compile(
            "\\b(?:facilit(?:y|ies)|amenit(?:y|ies)|kitchen|wifi|wi-fi|internet|parking|bbq|barbecue|heater|heating|geyser"
                    + "|tv|netflix|chef|cook|food|terrace|balcony|lounge|linen|towels?|generator|electricity)\\b");

    private static final Pattern ROOMS = Pattern.compile(
            "\\b(?:cottages?|bedrooms?|rooms?|beds?|property|accommodation|attic|storey|floor|capacity|accommodate|layout|photos?|pictures?|images?)\\b");

    /**
     * Pricing question test. "rate" alone only counts next to stay vocabulary,
     * and golf, exchange, interest, discount or occupancy rates never count.
     */
    public boolean isPricingQuery(String text) {
        if (StringUtils.isBlank(text)) return false;
        String t = text.toLowerCase(Locale.ROOT);
        if (PRICING_EXCLUSIONS.matcher(t).find()) return false;
        if (PRICING_PRIMARY.matcher(t).find()) return true;
        if (DATE_RANGE_STAY.matcher(t).find()) return true;
        if (RATE.matcher(t).find() && RATE_CONTEXT.matcher(t).find()) return true;
        return PRICING_PHRASES.matcher(t).find();
    }

    public boolean isSafetyQuery(String text) {
        return text != null && SAFETY.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Topic intent for an information question, checked in order: pricing,
     * booking, availability, safety, location, facilities, rooms.
     */
    public Optional<Intent> detect(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String t = text.toLowerCase(Locale.ROOT);
        if (isPricingQuery(t)) return Optional.of(Intent.PRICING);
        if (BOOKING.matcher(t).find()) return Optional.of(Intent.BOOKING);
        if (AVAILABILITY.matcher(t).find()) return Optional.of(Intent.AVAILABILITY);
        if (SAFETY.matcher(t).find()) return Optional.of(Intent.SAFETY);
        if (LOCATION.matcher(t).find()) return Optional.of(Intent.LOCATION);
        if (FACILITIES.matcher(t).find()) return Optional.of(Intent.FACILITIES);
        if (ROOMS.matcher(t).find()) return Optional.of(Intent.ROOMS);
        return Optional.empty();
    }
}
