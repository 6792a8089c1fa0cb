package com.ai.concierge.service;

import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.DateValidation;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotName;
import com.ai.concierge.dto.PricingResult;
import com.ai.concierge.dto.RetrievedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Answers pricing questions from slots and the question text.
 * <p>
 * Either every input is known and the price is computed, or the result names
 * what is missing. Dates are never invented, except that an explicit night
 * count without dates is laid out from today (or next Monday for "next week")
 * so the breakdown has real calendar days.
 * </p>
 */
@Service
public class PricingQueryHandler {

    private static final Logger log = LoggerFactory.getLogger(PricingQueryHandler.class);

    public static final String MISSING_DATES = "dates or nights";
    public static final String MISSING_COTTAGE = SlotName.COTTAGE_ID.key();

    static final String PRICING_SOURCE = "structured_pricing_analysis";

    private static final Pattern WEEKDAYS_ONLY = Pattern.compile(
            "\\b(?:week\\s?days?\\s+only|only\\s+(?:on\\s+)?week\\s?days?)\\b");
    private static final Pattern ON_WEEKDAYS = Pattern.compile("\\bon\\s+week\\s?days?\\b");
    private static final Pattern WEEKEND = Pattern.compile("\\bweek\\s?ends?\\b");

    private final PricingCalculator calculator;
    private final CottageCatalog catalog;
    private final DateExtractor dateExtractor;
    private final NumberExtractor numberExtractor;
    private final TopicDetector topicDetector;
    private final int baseOccupancy;

    public PricingQueryHandler(PricingCalculator calculator,
                               CottageCatalog catalog,
                               DateExtractor dateExtractor,
                               NumberExtractor numberExtractor,
                               TopicDetector topicDetector,
                               ConciergeProperties properties) {
        this.calculator = calculator;
        this.catalog = catalog;
        this.dateExtractor = dateExtractor;
        this.numberExtractor = numberExtractor;
        this.topicDetector = topicDetector;
        this.baseOccupancy = properties.getDefaults().getBaseOccupancy();
    }

    public boolean isPricingQuery(String question) {
        return topicDetector.isPricingQuery(question);
    }

    public PricingResult processPricingQuery(String question, Map<SlotName, Object> slots, List<RetrievedDocument> documents) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);

        String cottage = resolveCottage(q, slots);
        int guests = slots.get(SlotName.GUESTS) instanceof Integer g
                ? g
                : numberExtractor.extractGroupSize(q).orElse(baseOccupancy);
        Optional<DateRange> dates = resolveDates(q, slots);

        List<String> missing = new ArrayList<>();
        if (dates.isEmpty()) missing.add(MISSING_DATES);
        if (cottage == null) missing.add(MISSING_COTTAGE);
        if (!missing.isEmpty()) {
            log.debug("Pricing question missing {}", missing);
            return PricingResult.missing(missing, missingInfoTemplate(missing, cottage, documents));
        }

        DateValidation validation = dateExtractor.validateDateRange(dates.get());
        if (!validation.valid()) {
            return PricingResult.error(cottage, validation.reason(),
                    "The requested dates cannot be priced: " + validation.reason()
                            + " Ask the guest to confirm their check-in and check-out dates.");
        }

        Optional<PricingCalculator.Rates> rates = calculator.getRates(cottage, documents);
        if (rates.isEmpty()) {
            String error = "Pricing for Cottage " + cottage + " is not available in the system.";
            return PricingResult.error(cottage, error, error
                    + " Do not quote a price. Suggest contacting the cottage manager for current rates."
                    + ratesOverview(documents));
        }

        PricingResult result = calculator.calculate(cottage, guests, dates.get(), rates.get());
        return result.withTemplate(computedTemplate(result));
    }

    /**
     * Copy of {@code documents} with the pricing analysis placed first, so the
     * answer step surfaces the computed figures instead of recomputing them.
     */
    public List<RetrievedDocument> enhanceContext(List<RetrievedDocument> documents, PricingResult result) {
        List<RetrievedDocument> out = new ArrayList<>();
        if (result != null && result.template() != null && !result.template().isBlank()) {
            out.add(RetrievedDocument.of(result.template(), Map.of(
                    "source", PRICING_SOURCE,
                    "type", "pricing_analysis",
                    "has_all_info", result.hasAllInfo())));
        }
        if (documents != null) out.addAll(documents);
        return out;
    }

    private String resolveCottage(String q, Map<SlotName, Object> slots) {
        if (slots.get(SlotName.COTTAGE_ID) instanceof String c && !SlotDefinitions.ANY_COTTAGE.equals(c)) {
            return c;
        }
        return numberExtractor.extractCottageNumber(q).filter(catalog::exists).orElse(null);
    }

    /**
     * A night count in the question reshapes dates from the same question or
     * from the session; a remembered night count only applies to remembered
     * dates. A nights-only stay starts today or next Monday.
     */
    private Optional<DateRange> resolveDates(String q, Map<SlotName, Object> slots) {
        Optional<DateRange> dates = dateExtractor.extractDateRange(q);
        Optional<Integer> nights = numberExtractor.extractNights(q);
        if (dates.isEmpty()) {
            if (slots.get(SlotName.DATES) instanceof DateRange stored) {
                dates = Optional.of(stored);
            }
            if (nights.isEmpty() && slots.get(SlotName.NIGHTS) instanceof Integer n) {
                nights = Optional.of(n);
            }
        }
        if (nights.isEmpty()) return dates;

        int count = nights.get();
        if (dates.isPresent()) {
            DateRange given = dates.get();
            return Optional.of(given.nights() == count ? given : DateRange.of(given.start(), given.start().plusDays(count)));
        }
        LocalDate start = dateExtractor.mentionsNextWeek(q) ? dateExtractor.nextMonday() : dateExtractor.today();
        if (isWeekdaysOnly(q)) {
            return Optional.of(DateRange.ofNights(weekdayNights(start, count)));
        }
        return Optional.of(DateRange.of(start, start.plusDays(count)));
    }

    /** "weekdays only" or "only on weekdays"; a plain "on weekdays" counts unless weekends come up too. */
    static boolean isWeekdaysOnly(String q) {
        if (WEEKDAYS_ONLY.matcher(q).find()) return true;
        return ON_WEEKDAYS.matcher(q).find() && !WEEKEND.matcher(q).find();
    }

    private static List<LocalDate> weekdayNights(LocalDate from, int count) {
        List<LocalDate> nights = new ArrayList<>();
        for (LocalDate d = from; nights.size() < count; d = d.plusDays(1)) {
            if (!DateRange.isWeekend(d)) nights.add(d);
        }
        return nights;
    }

    private String computedTemplate(PricingResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append("PRICING CALCULATION FOR COTTAGE ").append(r.cottage()).append('\n');
        sb.append("Stay: ").append(r.dates().describe()).append('\n');
        sb.append("Guests: ").append(r.guests()).append('\n');
        sb.append("Nights: ").append(r.nights()).append(" (").append(r.weekdayNights()).append(" weekday, ")
                .append(r.weekendNights()).append(" weekend)\n\n");
        sb.append(r.breakdown()).append("\n\n");
        sb.append("**Total Cost: PKR ").append(PricingCalculator.pkr(r.totalPrice())).append("**\n\n");
        sb.append("Use these exact figures in the answer. Do not recalculate or change the dates.");
        return sb.toString();
    }

    private String missingInfoTemplate(List<String> missing, String cottage, List<RetrievedDocument> documents) {
        StringBuilder sb = new StringBuilder();
        sb.append("PRICING INFORMATION");
        if (cottage != null) sb.append(" FOR COTTAGE ").append(cottage);
        sb.append('\n');
        sb.append(ratesOverview(documents)).append('\n');
        if (missing.contains(MISSING_DATES)) {
            sb.append("To calculate the total cost, the check-in and check-out dates (or the number of nights) are needed. ")
                    .append("Ask the guest for their dates. Do not assume or invent dates.\n");
        }
        if (missing.contains(MISSING_COTTAGE)) {
            sb.append("Ask which cottage the guest is interested in (")
                    .append(String.join(", ", catalog.shownByDefault().stream().map(c -> "Cottage " + c.number()).toList()))
                    .append(").\n");
        }
        return sb.toString().trim();
    }

    private String ratesOverview(List<RetrievedDocument> documents) {
        StringBuilder sb = new StringBuilder("\nNightly rates (up to ").append(baseOccupancy).append(" guests):");
        for (CottageCatalog.Cottage c : catalog.all()) {
            Optional<PricingCalculator.Rates> rates = calculator.getRates(c.number(), documents);
            if (rates.isPresent()) {
                sb.append("\n- Cottage ").append(c.number()).append(": PKR ").append(PricingCalculator.pkr(rates.get().weekday()))
                        .append(" per night on weekdays, PKR ").append(PricingCalculator.pkr(rates.get().weekend()))
                        .append(" per night on weekends");
            }
        }
        return sb.toString();
    }
}
