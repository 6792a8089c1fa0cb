package com.ai.concierge.service;

import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.dto.PricingResult;
import com.ai.concierge.dto.RetrievedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stay pricing: weekday nights at the weekday rate, weekend
 * nights at the weekend rate, with a per-night breakdown.
 */
@Service
public class PricingCalculator {

    private static final Logger log = LoggerFactory.getLogger(PricingCalculator.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMMM d, yyyy (EEEE)", Locale.ENGLISH);

    private static final Pattern DOC_COTTAGE = Pattern.compile("\\bcottage\\s*(\\d+)\\b");
    private static final Pattern WEEKEND_RATE = Pattern.compile(
            "(?:approximately\\s+)?pkr\\s*([\\d,]+)\\s*per\\s*night\\s*on\\s*weekends?");
    private static final Pattern WEEKDAY_RATE = Pattern.compile(
            "(?:approximately\\s+)?pkr\\s*([\\d,]+)\\s*per\\s*night\\s*on\\s*weekdays?");

    private final CottageCatalog catalog;
    private final int baseOccupancy;

    public PricingCalculator(CottageCatalog catalog, ConciergeProperties properties) {
        this.catalog = catalog;
        this.baseOccupancy = properties.getDefaults().getBaseOccupancy();
    }

    /** Configured rates for the cottage, or empty when unknown. */
    public Optional<Rates> getRates(String cottage) {
        return catalog.find(cottage)
                .filter(CottageCatalog.Cottage::hasRates)
                .map(c -> new Rates(c.weekdayRate(), c.weekendRate()));
    }

    /**
     * Configured rates, falling back to rates quoted in the given documents for
     * cottages without configured prices.
     */
    public Optional<Rates> getRates(String cottage, List<RetrievedDocument> documents) {
        Optional<Rates> configured = getRates(cottage);
        if (configured.isPresent() || documents == null) return configured;
        for (RetrievedDocument doc : documents) {
            Optional<Rates> quoted = extractRates(doc.content())
                    .filter(r -> cottage.equals(r.cottage()))
                    .map(QuotedRates::rates);
            if (quoted.isPresent()) {
                log.info("Using rates quoted in {} for cottage {}", doc.source(), cottage);
                return quoted;
            }
        }
        return Optional.empty();
    }

    /** Reads "PKR X per night on weekends ... PKR Y per night on weekdays" for the first cottage a text names. */
    public Optional<QuotedRates> extractRates(String content) {
        if (content == null) return Optional.empty();
        String t = content.toLowerCase(Locale.ROOT);
        Matcher cottage = DOC_COTTAGE.matcher(t);
        Matcher weekend = WEEKEND_RATE.matcher(t);
        Matcher weekday = WEEKDAY_RATE.matcher(t);
        if (!cottage.find() || !weekend.find() || !weekday.find()) return Optional.empty();
        try {
            int weekendRate = Integer.parseInt(weekend.group(1).replace(",", ""));
            int weekdayRate = Integer.parseInt(weekday.group(1).replace(",", ""));
            return Optional.of(new QuotedRates(cottage.group(1), new Rates(weekdayRate, weekendRate)));
        } catch (NumberFormatException e) {
            log.debug("Unreadable rate in '{}'", t, e);
            return Optional.empty();
        }
    }

    /** Computes the total for a stay. The caller guarantees the dates; rates must be known. */
    public PricingResult calculate(String cottage, int guests, DateRange dates, Rates rates) {
        int weekdayTotal = dates.weekdayNights() * rates.weekday();
        int weekendTotal = dates.weekendNights() * rates.weekend();
        int total = weekdayTotal + weekendTotal;

        List<String> weekdayLines = new ArrayList<>();
        List<String> weekendLines = new ArrayList<>();
        for (LocalDate night : dates.nightDates()) {
            if (DateRange.isWeekend(night)) {
                weekendLines.add("  - " + DAY.format(night) + ": PKR " + pkr(rates.weekend()));
            } else {
                weekdayLines.add("  - " + DAY.format(night) + ": PKR " + pkr(rates.weekday()));
            }
        }

        StringBuilder breakdown = new StringBuilder();
        if (!weekdayLines.isEmpty()) {
            breakdown.append("**Weekday Nights (").append(dates.weekdayNights()).append(" nights) at PKR ")
                    .append(pkr(rates.weekday())).append(" per night:**\n");
            weekdayLines.forEach(line -> breakdown.append(line).append('\n'));
            breakdown.append("  Subtotal: PKR ").append(pkr(weekdayTotal));
        }
        if (!weekendLines.isEmpty()) {
            if (breakdown.length() > 0) breakdown.append("\n\n");
            breakdown.append("**Weekend Nights (").append(dates.weekendNights()).append(" nights) at PKR ")
                    .append(pkr(rates.weekend())).append(" per night:**\n");
            weekendLines.forEach(line -> breakdown.append(line).append('\n'));
            breakdown.append("  Subtotal: PKR ").append(pkr(weekendTotal));
        }
        if (guests > baseOccupancy) {
            breakdown.append("\n\nNote: Base pricing is for up to ").append(baseOccupancy).append(" guests. For ")
                    .append(guests).append(" guests, prior confirmation and adjusted pricing may apply.");
        }

        log.debug("Cottage {} for {} nights ({} weekday, {} weekend): PKR {}",
                cottage, dates.nights(), dates.weekdayNights(), dates.weekendNights(), total);
        return PricingResult.computed(cottage, guests, dates, rates.weekday(), rates.weekend(), total, breakdown.toString());
    }

    /** Cottages with known rates. */
    public List<String> getAllCottages() {
        return catalog.all().stream()
                .filter(CottageCatalog.Cottage::hasRates)
                .map(CottageCatalog.Cottage::number)
                .toList();
    }

    public static String pkr(int amount) {
        return String.format(Locale.ENGLISH, "%,d", amount);
    }

    public record Rates(int weekday, int weekend) {
    }

    public record QuotedRates(String cottage, Rates rates) {
    }
}
