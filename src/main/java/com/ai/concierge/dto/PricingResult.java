package com.ai.concierge.dto;

import com.ai.concierge.conversation.DateRange;

import java.util.List;

/**
 * Outcome of a pricing question. A computed result carries a total and no
 * missing slots; a missing-information result carries missing slots and no
 * total; an error result carries neither.
 */
public record PricingResult(Status status,
                            String cottage,
                            int guests,
                            DateRange dates,
                            int weekdayRate,
                            int weekendRate,
                            Integer totalPrice,
                            String breakdown,
                            String template,
                            List<String> missingSlots,
                            String error) {

    public enum Status {
        COMPUTED,
        MISSING_INFO,
        ERROR
    }

    public PricingResult {
        missingSlots = missingSlots == null ? List.of() : List.copyOf(missingSlots);
    }

    public static PricingResult computed(String cottage, int guests, DateRange dates, int weekdayRate, int weekendRate,
                                         int totalPrice, String breakdown) {
        return new PricingResult(Status.COMPUTED, cottage, guests, dates, weekdayRate, weekendRate,
                totalPrice, breakdown, null, List.of(), null);
    }

    public static PricingResult missing(List<String> missingSlots, String template) {
        if (missingSlots == null || missingSlots.isEmpty()) {
            throw new IllegalArgumentException("a missing-information result names what is missing");
        }
        return new PricingResult(Status.MISSING_INFO, null, 0, null, 0, 0, null, null, template, missingSlots, null);
    }

    public static PricingResult error(String cottage, String error, String template) {
        return new PricingResult(Status.ERROR, cottage, 0, null, 0, 0, null, null, template, List.of(), error);
    }

    public PricingResult withTemplate(String template) {
        return new PricingResult(status, cottage, guests, dates, weekdayRate, weekendRate,
                totalPrice, breakdown, template, missingSlots, error);
    }

    public boolean hasAllInfo() {
        return status == Status.COMPUTED;
    }

    public int nights() {
        return dates == null ? 0 : dates.nights();
    }

    public int weekdayNights() {
        return dates == null ? 0 : dates.weekdayNights();
    }

    public int weekendNights() {
        return dates == null ? 0 : dates.weekendNights();
    }
}
