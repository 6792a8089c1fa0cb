package com.ai.concierge.service;

import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotName;
import com.ai.concierge.dto.RetrievedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Answers "will this cottage fit my group" questions from the cottage catalog.
 * Group size and cottage come from the turn's slots or the question; when only
 * one is known the result still answers what it can and names what is missing.
 */
@Service
public class CapacityHandler {

    private static final Logger log = LoggerFactory.getLogger(CapacityHandler.class);

    public static final String MISSING_GROUP_SIZE = SlotName.GUESTS.key();
    public static final String MISSING_COTTAGE = SlotName.COTTAGE_ID.key();

    static final String CAPACITY_SOURCE = "structured_capacity_analysis";

    private static final Pattern FAMILY = Pattern.compile("\\b(?:family|families|kids|children|child)\\b");

    private final NumberExtractor numberExtractor;
    private final DateExtractor dateExtractor;
    private final CottageCatalog catalog;
    private final int baseOccupancy;
    private final int maxOccupancy;

    public CapacityHandler(NumberExtractor numberExtractor,
                           DateExtractor dateExtractor,
                           CottageCatalog catalog,
                           ConciergeProperties properties) {
        this.numberExtractor = numberExtractor;
        this.dateExtractor = dateExtractor;
        this.catalog = catalog;
        this.baseOccupancy = properties.getDefaults().getBaseOccupancy();
        this.maxOccupancy = properties.getDefaults().getMaxOccupancy();
    }

    public boolean isCapacityQuery(String question) {
        return numberExtractor.isCapacityQuery(question);
    }

    public CapacityResult processCapacityQuery(String question, Map<SlotName, Object> slots) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
        Integer groupSize = numberExtractor.extractGroupSize(q)
                .orElse(slots.get(SlotName.GUESTS) instanceof Integer g ? g : null);
        String cottage = numberExtractor.extractCottageNumber(q)
                .orElse(slots.get(SlotName.COTTAGE_ID) instanceof String c && !SlotDefinitions.ANY_COTTAGE.equals(c) ? c : null);
        if (cottage != null && !catalog.exists(cottage)) {
            log.debug("Unknown cottage {} in capacity question, answering for the group only", cottage);
            cottage = null;
        }
        boolean family = FAMILY.matcher(q).find() || Boolean.TRUE.equals(slots.get(SlotName.FAMILY));
        boolean hasDates = dateExtractor.extractDateRange(q).isPresent() || slots.containsKey(SlotName.DATES);

        if (groupSize == null && cottage == null) {
            return new CapacityResult(null, null, null, null, generalTemplate(),
                    false, List.of(MISSING_GROUP_SIZE, MISSING_COTTAGE));
        }
        if (groupSize == null) {
            return new CapacityResult(null, cottage, null, null, cottageTemplate(cottage),
                    false, List.of(MISSING_GROUP_SIZE));
        }
        if (cottage == null) {
            return groupOnly(groupSize, family, hasDates);
        }

        CottageCatalog.Suitability suitability = catalog.isSuitable(cottage, groupSize);
        StringBuilder sb = new StringBuilder();
        sb.append("CAPACITY CHECK: COTTAGE ").append(cottage).append(" FOR ").append(groupSize).append(" GUESTS\n");
        sb.append(suitability.reason()).append('\n');
        if (!suitability.suitable()) {
            sb.append(alternativesFor(groupSize, cottage));
        }
        return new CapacityResult(groupSize, cottage, suitability.suitable(), suitability.reason(),
                sb.toString().trim(), true, List.of());
    }

    /** Copy of {@code documents} with the capacity analysis placed first. */
    public List<RetrievedDocument> enhanceContext(List<RetrievedDocument> documents, CapacityResult result) {
        List<RetrievedDocument> out = new ArrayList<>();
        if (result != null && result.template() != null && !result.template().isBlank()) {
            out.add(RetrievedDocument.of(result.template(), Map.of(
                    "source", CAPACITY_SOURCE,
                    "type", "capacity_analysis",
                    "has_all_info", result.hasAllInfo())));
        }
        if (documents != null) out.addAll(documents);
        return out;
    }

    private CapacityResult groupOnly(int groupSize, boolean family, boolean hasDates) {
        StringBuilder sb = new StringBuilder();
        sb.append("CAPACITY CHECK: GROUP OF ").append(groupSize).append('\n');
        String reason;
        Boolean suitable;
        if (groupSize <= baseOccupancy) {
            suitable = true;
            reason = "Any of our cottages comfortably accommodates " + groupSize + " guests.";
            sb.append(reason).append('\n');
            if (family) {
                sb.append("For families, the three-bedroom cottages are popular choices:\n");
                catalog.all().stream().filter(c -> c.bedrooms() >= 3).forEach(c ->
                        sb.append("- Cottage ").append(c.number()).append(": ").append(c.description()).append('\n'));
            } else {
                catalog.shownByDefault().forEach(c ->
                        sb.append("- Cottage ").append(c.number()).append(": ").append(c.description()).append('\n'));
            }
        } else if (groupSize <= maxOccupancy) {
            suitable = true;
            reason = "A single cottage can accommodate " + groupSize + " guests with prior confirmation (standard capacity "
                    + baseOccupancy + ", maximum " + maxOccupancy + ").";
            sb.append(reason).append('\n');
        } else {
            suitable = false;
            reason = "A single cottage takes at most " + maxOccupancy + " guests. For " + groupSize
                    + " guests, booking multiple cottages is recommended.";
            sb.append(reason).append('\n');
            sb.append("The property has ").append(catalog.totalCottages()).append(" cottages in total.\n");
        }
        if (!hasDates) {
            sb.append("Ask the guest for their dates to check availability.\n");
        }
        return new CapacityResult(groupSize, null, suitable, reason, sb.toString().trim(), false, List.of(MISSING_COTTAGE));
    }

    private String cottageTemplate(String cottage) {
        CottageCatalog.Cottage c = catalog.capacityOf(cottage);
        return "COTTAGE " + c.number() + " CAPACITY\n"
                + c.description() + "\n"
                + "Standard capacity: up to " + c.baseOccupancy() + " guests.\n"
                + "Maximum: " + c.maxOccupancy() + " guests with prior confirmation.\n"
                + "Larger groups can book multiple cottages.";
    }

    private String generalTemplate() {
        StringBuilder sb = new StringBuilder("COTTAGE CAPACITY OVERVIEW\n");
        for (CottageCatalog.Cottage c : catalog.shownByDefault()) {
            sb.append("- Cottage ").append(c.number()).append(" (").append(c.bedrooms()).append(" bedrooms): up to ")
                    .append(c.baseOccupancy()).append(" guests standard, ").append(c.maxOccupancy())
                    .append(" with prior confirmation. ").append(c.description()).append('\n');
        }
        sb.append("Larger groups can book multiple cottages.");
        return sb.toString();
    }

    private String alternativesFor(int groupSize, String cottage) {
        List<String> fitting = catalog.all().stream()
                .filter(c -> !c.number().equals(cottage) && groupSize <= c.maxOccupancy())
                .map(c -> "Cottage " + c.number())
                .toList();
        if (fitting.isEmpty()) {
            return "Suggest booking multiple cottages for this group.";
        }
        return "Alternatives that fit: " + String.join(", ", fitting) + ".";
    }

    /**
     * Outcome of a capacity question. {@code suitable} is null when no judgement
     * was possible; {@code hasAllInfo} means both group size and cottage were known.
     */
    public record CapacityResult(Integer groupSize,
                                 String cottage,
                                 Boolean suitable,
                                 String reason,
                                 String template,
                                 boolean hasAllInfo,
                                 List<String> missingSlots) {

        public CapacityResult {
            missingSlots = missingSlots == null ? List.of() : List.copyOf(missingSlots);
        }
    }
}
