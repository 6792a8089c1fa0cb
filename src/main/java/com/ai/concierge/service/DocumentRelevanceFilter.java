package com.ai.concierge.service;

import com.ai.concierge.dto.RetrievedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrows and reorders retrieved passages before they reach the answer step.
 * <p>
 * Each pass takes a list and returns a new one. Passes never call out of
 * process. The last check may reject the whole set when the question is about
 * a place the knowledge base does not cover.
 * </p>
 */
@Service
public class DocumentRelevanceFilter {

    private static final Logger log = LoggerFactory.getLogger(DocumentRelevanceFilter.class);

    private static final Pattern DOC_COTTAGE = Pattern.compile("\\bcottage\\s*(?:number|no\\.?|#)?\\s*(\\d+)\\b");

    private static final Pattern PRICING_CONTENT = Pattern.compile(
            "\\b(?:pkr|per night|tariff|price|pricing|rates?)\\b");

    private static final Pattern SAFETY_CONTENT = Pattern.compile(
            "\\b(?:guards?|gated|security|secure|cctv|safe|safety)\\b");

    /** Places a question may name, mapped to places that contradict them. */
    private static final Map<String, List<String>> LOCATION_CONFLICTS = new LinkedHashMap<>();

    static {
        LOCATION_CONFLICTS.put("india", List.of("pakistan", "bhurban", "murree", "azad kashmir", "pakistani"));
        LOCATION_CONFLICTS.put("pakistan", List.of("india", "mumbai", "delhi", "bangalore", "indian"));
        LOCATION_CONFLICTS.put("bhurban", List.of("india", "mumbai", "delhi", "indian"));
        LOCATION_CONFLICTS.put("murree", List.of("india", "mumbai", "delhi", "indian"));
    }

    private static final List<String> PROPERTY_ANCHORS = List.of("swiss cottages bhurban", "bhurban");

    private final NumberExtractor numberExtractor;
    private final TopicDetector topicDetector;
    private final CottageCatalog catalog;

    public DocumentRelevanceFilter(NumberExtractor numberExtractor, TopicDetector topicDetector, CottageCatalog catalog) {
        this.numberExtractor = numberExtractor;
        this.topicDetector = topicDetector;
        this.catalog = catalog;
    }

    public FilterOutcome filterAndPrioritize(List<RetrievedDocument> documents, String query) {
        if (documents == null || documents.isEmpty()) return FilterOutcome.accepted(List.of());
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);

        Optional<String> mismatch = locationMismatch(q, documents);
        if (mismatch.isPresent()) {
            log.info("Rejecting {} documents: {}", documents.size(), mismatch.get());
            return FilterOutcome.rejected(mismatch.get());
        }

        List<String> named = numberExtractor.extractCottageNumbers(q).stream().filter(catalog::exists).toList();
        List<RetrievedDocument> out = scopeToCottages(documents, q, named);
        if (!topicDetector.isPricingQuery(q)) {
            out = moveToEnd(out, doc -> PRICING_CONTENT.matcher(lower(doc)).find());
        }
        if (topicDetector.isSafetyQuery(q)) {
            out = moveToFront(out, doc -> SAFETY_CONTENT.matcher(lower(doc)).find());
        }
        if (!named.isEmpty()) {
            out = moveToFront(out, doc -> mentionedCottages(doc).stream().anyMatch(named::contains));
        } else if (numberExtractor.isCapacityQuery(q)) {
            out = moveToFront(out, doc -> !mentionedCottages(doc).isEmpty());
        }

        if (out.size() != documents.size()) {
            log.debug("Relevance filter kept {} of {} documents", out.size(), documents.size());
        }
        return FilterOutcome.accepted(out);
    }

    /**
     * Drops documents that talk only about cottages the query did not ask for.
     * With no cottage named, the allowed set is what a generic answer may show.
     */
    List<RetrievedDocument> scopeToCottages(List<RetrievedDocument> documents, String q, List<String> named) {
        Set<String> allowed = new LinkedHashSet<>(named);
        if (allowed.isEmpty()) {
            catalog.listCottagesByFilter(q).forEach(c -> allowed.add(c.number()));
        }
        List<RetrievedDocument> out = new ArrayList<>();
        for (RetrievedDocument doc : documents) {
            Set<String> mentioned = mentionedCottages(doc);
            if (mentioned.isEmpty() || mentioned.stream().anyMatch(allowed::contains)) {
                out.add(doc);
            } else {
                log.debug("Dropping document from {} about cottages {}", doc.source(), mentioned);
            }
        }
        return out;
    }

    Optional<String> locationMismatch(String q, List<RetrievedDocument> documents) {
        StringBuilder all = new StringBuilder();
        documents.forEach(doc -> all.append(lower(doc)).append(' '));
        String text = all.toString();

        for (Map.Entry<String, List<String>> entry : LOCATION_CONFLICTS.entrySet()) {
            String place = entry.getKey();
            if (!mentions(q, place) || mentions(text, place)) continue;
            for (String conflict : entry.getValue()) {
                if (mentions(text, conflict)) {
                    return Optional.of("Your question mentions '" + place + "', but the available information is about '"
                            + conflict + "'. These don't match.");
                }
            }
        }
        boolean anchored = PROPERTY_ANCHORS.stream().anyMatch(text::contains);
        if (anchored && mentions(q, "india") && !mentions(text, "india")) {
            return Optional.of("Your question asks about 'India', but the available information is about "
                    + "Swiss Cottages Bhurban in Pakistan. These don't match.");
        }
        return Optional.empty();
    }

    private static Set<String> mentionedCottages(RetrievedDocument doc) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = DOC_COTTAGE.matcher(lower(doc));
        while (m.find()) found.add(m.group(1));
        Object metadataCottage = doc.metadata().get("cottage_id");
        if (metadataCottage != null && !metadataCottage.toString().isBlank()) {
            found.add(metadataCottage.toString());
        }
        return found;
    }

    private static List<RetrievedDocument> moveToFront(List<RetrievedDocument> documents, Predicate<RetrievedDocument> test) {
        List<RetrievedDocument> first = new ArrayList<>();
        List<RetrievedDocument> rest = new ArrayList<>();
        documents.forEach(doc -> (test.test(doc) ? first : rest).add(doc));
        first.addAll(rest);
        return first;
    }

    private static List<RetrievedDocument> moveToEnd(List<RetrievedDocument> documents, Predicate<RetrievedDocument> test) {
        return moveToFront(documents, test.negate());
    }

    private static boolean mentions(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static String lower(RetrievedDocument doc) {
        return doc.content().toLowerCase(Locale.ROOT);
    }

    /** Either the documents to answer from, or why none of them can be used. */
    public record FilterOutcome(boolean accepted, List<RetrievedDocument> documents, String reason) {

        public FilterOutcome {
            documents = documents == null ? List.of() : List.copyOf(documents);
        }

        public static FilterOutcome accepted(List<RetrievedDocument> documents) {
            return new FilterOutcome(true, documents, null);
        }

        public static FilterOutcome rejected(String reason) {
            return new FilterOutcome(false, List.of(), reason);
        }
    }
}
