package com.ai.concierge.service;

import com.ai.concierge.config.ConciergeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cottages on the property with their layout, occupancy limits and nightly rates.
 */
@Service
public class CottageCatalog {

    private static final Logger log = LoggerFactory.getLogger(CottageCatalog.class);

    private static final Pattern TWO_BEDROOM = Pattern.compile("\\b(?:2|two)[\\s-]*bed(?:room)?s?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern THREE_BEDROOM = Pattern.compile("\\b(?:3|three)[\\s-]*bed(?:room)?s?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COTTAGE_NUMBER = Pattern.compile("\\bcottage\\s*(?:number|no\\.?|#)?\\s*(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final Map<String, ConciergeProperties.Cottage> cottages;
    private final int totalCottages;
    private final int defaultBase;
    private final int defaultMax;

    public CottageCatalog(ConciergeProperties properties) {
        this.cottages = properties.getCottages();
        this.totalCottages = properties.getTotalCottages();
        this.defaultBase = properties.getDefaults().getBaseOccupancy();
        this.defaultMax = properties.getDefaults().getMaxOccupancy();
        cottages.forEach((number, c) -> {
            if (c.getWeekdayRate() > 0 || c.getWeekendRate() > 0) {
                log.info("Loaded pricing for cottage {}: weekday PKR {}, weekend PKR {}", number,
                        String.format("%,d", c.getWeekdayRate()), String.format("%,d", c.getWeekendRate()));
            } else {
                log.warn("No configured rates for cottage {}", number);
            }
        });
    }

    public Optional<Cottage> find(String number) {
        if (number == null) return Optional.empty();
        ConciergeProperties.Cottage c = cottages.get(normalize(number));
        return c == null ? Optional.empty() : Optional.of(toCottage(normalize(number), c));
    }

    public boolean exists(String number) {
        return number != null && cottages.containsKey(normalize(number));
    }

    /** Known cottage, or a generic 2-bedroom entry with the default occupancy limits. */
    public Cottage capacityOf(String number) {
        return find(number).orElseGet(() -> new Cottage(normalize(number), 2, defaultBase, defaultMax, 0, 0,
                "Cottage " + normalize(number), false, false));
    }

    public List<Cottage> all() {
        List<Cottage> all = new ArrayList<>();
        cottages.forEach((number, c) -> all.add(toCottage(number, c)));
        return all;
    }

    public List<Cottage> recommended() {
        return all().stream().filter(Cottage::recommended).toList();
    }

    /** Cottages that generic answers may talk about without being asked. */
    public List<Cottage> shownByDefault() {
        return all().stream().filter(Cottage::showByDefault).toList();
    }

    /** Public listing page for the cottage, when one is configured. */
    public Optional<String> listingUrl(String number) {
        ConciergeProperties.Cottage c = number == null ? null : cottages.get(normalize(number));
        return c == null || c.getListingUrl() == null || c.getListingUrl().isBlank()
                ? Optional.empty()
                : Optional.of(c.getListingUrl());
    }

    public int totalCottages() {
        return totalCottages;
    }

    /**
     * Whether one cottage takes the group: up to base occupancy as standard, up
     * to the maximum with prior confirmation, otherwise not at all.
     */
    public Suitability isSuitable(String number, int groupSize) {
        Cottage cottage = capacityOf(number);
        if (groupSize <= cottage.baseOccupancy()) {
            return new Suitability(true, false, String.format(
                    "Cottage %s comfortably accommodates %d guests (standard capacity up to %d).",
                    cottage.number(), groupSize, cottage.baseOccupancy()));
        }
        if (groupSize <= cottage.maxOccupancy()) {
            return new Suitability(true, true, String.format(
                    "Cottage %s can accommodate %d guests with prior confirmation (standard capacity %d, maximum %d).",
                    cottage.number(), groupSize, cottage.baseOccupancy(), cottage.maxOccupancy()));
        }
        return new Suitability(false, false, String.format(
                "Cottage %s takes at most %d guests. For %d guests, consider booking multiple cottages.",
                cottage.number(), cottage.maxOccupancy(), groupSize));
    }

    /**
     * Cottages to talk about for a query: the ones it names, the ones matching a
     * bedroom count, or the recommended ones.
     */
    public List<Cottage> listCottagesByFilter(String query) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<Cottage> named = new ArrayList<>();
        var m = COTTAGE_NUMBER.matcher(q);
        while (m.find()) {
            find(m.group(1)).filter(c -> !named.contains(c)).ifPresent(named::add);
        }
        if (!named.isEmpty()) return named;
        if (TWO_BEDROOM.matcher(q).find()) {
            return all().stream().filter(c -> c.bedrooms() == 2).toList();
        }
        if (THREE_BEDROOM.matcher(q).find()) {
            return all().stream().filter(c -> c.bedrooms() == 3).toList();
        }
        return recommended();
    }

    private static String normalize(String number) {
        return number == null ? "" : number.trim().toLowerCase(Locale.ROOT).replaceFirst("^cottage[_\\s]*", "");
    }

    private static Cottage toCottage(String number, ConciergeProperties.Cottage c) {
        return new Cottage(number, c.getBedrooms(), c.getBaseOccupancy(), c.getMaxOccupancy(),
                c.getWeekdayRate(), c.getWeekendRate(), c.getDescription(),
                Boolean.TRUE.equals(c.getRecommended()), Boolean.TRUE.equals(c.getShowByDefault()));
    }

    public record Cottage(String number,
                          int bedrooms,
                          int baseOccupancy,
                          int maxOccupancy,
                          int weekdayRate,
                          int weekendRate,
                          String description,
                          boolean recommended,
                          boolean showByDefault) {

        public boolean hasRates() {
            return weekdayRate > 0 || weekendRate > 0;
        }
    }

    public record Suitability(boolean suitable, boolean needsConfirmation, String reason) {
    }
}
