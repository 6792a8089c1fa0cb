package com.ai.concierge.service;

import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.ChatHistory;
import com.ai.concierge.conversation.Intent;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotName;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shapes the query, metadata filter and result count sent to the retrieval service.
 */
@Service
public class RetrievalQueryOptimizer {

    private static final Logger log = LoggerFactory.getLogger(RetrievalQueryOptimizer.class);

    static final int WIDE_K = 5;

    private static final Map<Intent, List<String>> INTENT_TERMS = new EnumMap<>(Intent.class);

    static {
        INTENT_TERMS.put(Intent.PRICING, List.of("PKR", "weekday", "weekend", "per night", "rate", "cost", "pricing"));
        INTENT_TERMS.put(Intent.AVAILABILITY, List.of("available", "booking", "vacancy", "dates", "availability"));
        INTENT_TERMS.put(Intent.SAFETY, List.of("security", "guards", "gated community", "safe", "safety"));
        INTENT_TERMS.put(Intent.ROOMS, List.of("cottage", "bedroom", "property", "accommodation", "cottage type"));
        INTENT_TERMS.put(Intent.FACILITIES, List.of("facility", "amenity", "kitchen", "terrace", "amenities"));
        INTENT_TERMS.put(Intent.LOCATION, List.of("location", "nearby", "attractions", "Bhurban", "Murree"));
        INTENT_TERMS.put(Intent.BOOKING, List.of("book", "booking", "reserve", "reservation"));
    }

    private static final Pattern WIDE_TOPICS = Pattern.compile(
            "\\b(?:payment|price|pricing|cost|rates?|methods|book|booking|reserve)\\b");
    private static final Pattern COTTAGE_SPECIFIC = Pattern.compile("\\bcottage\\s*\\d+\\b");
    private static final Pattern GROUP_WORDS = Pattern.compile(
            "\\b(?:members?|people|persons?|guests?|group|suitable|best for|accommodate|capacity|which cottage)\\b");

    private static final Pattern COMPLEX_DIGITS = Pattern.compile("\\d+");
    private static final List<Pattern> COMPLEX_INDICATORS = List.of(
            COMPLEX_DIGITS,
            Pattern.compile("\\b(?:which|what|how|when|where|why)\\b"),
            Pattern.compile("\\b(?:best|better|compare|difference|versus|vs)\\b"),
            Pattern.compile("\\b(?:and|or|but)\\b"));

    private static final List<String> REWRITE_PREFIXES = List.of(
            "optimized query:", "optimized:", "rewritten query:", "rewritten:", "standalone question:", "query:");

    private final CompletionClient completionClient;
    private final NumberExtractor numberExtractor;
    private final ConciergeProperties.Retrieval settings;
    private final int rewriteMaxTokens;

    public RetrievalQueryOptimizer(CompletionClient completionClient,
                                   NumberExtractor numberExtractor,
                                   ConciergeProperties properties) {
        this.completionClient = completionClient;
        this.numberExtractor = numberExtractor;
        this.settings = properties.getRetrieval();
        this.rewriteMaxTokens = properties.getCompletion().getRewriteMaxTokens();
    }

    /**
     * Appends up to three intent terms the query lacks, then the cottage and
     * group size, and optionally lets the completion service rewrite the result.
     */
    public String optimize(String query, Intent intent, Map<SlotName, Object> turnSlots) {
        if (StringUtils.isBlank(query)) return query;
        String q = query.toLowerCase(Locale.ROOT);
        StringBuilder enhanced = new StringBuilder(query.trim());

        List<String> missing = INTENT_TERMS.getOrDefault(intent, List.of()).stream()
                .filter(term -> !q.contains(term.toLowerCase(Locale.ROOT)))
                .limit(3)
                .toList();
        if (!missing.isEmpty()) enhanced.append(' ').append(String.join(" ", missing));

        cottage(turnSlots).map(c -> "cottage " + c)
                .filter(term -> !enhanced.toString().toLowerCase(Locale.ROOT).contains(term))
                .ifPresent(term -> enhanced.append(' ').append(term));
        numberExtractor.extractGroupSize(q).map(g -> g + " guests")
                .filter(term -> !enhanced.toString().toLowerCase(Locale.ROOT).contains(term))
                .ifPresent(term -> enhanced.append(' ').append(term));

        String result = enhanced.toString();
        if (Boolean.TRUE.equals(settings.getCompletionRewrite()) && isComplexQuery(query)) {
            result = rewrite(result);
        }
        log.debug("Retrieval query '{}' -> '{}'", query, result);
        return result;
    }

    /** Metadata filter {intent, cottage_id}; empty when filtering is switched off. */
    public Map<String, String> retrievalFilter(Intent intent, Map<SlotName, Object> turnSlots) {
        Map<String, String> filter = new LinkedHashMap<>();
        if (!Boolean.TRUE.equals(settings.getIntentFiltering())) return filter;
        if (intent != null && intent.isTopic()) filter.put("intent", intent.key());
        cottage(turnSlots).ifPresent(c -> filter.put("cottage_id", c));
        return filter;
    }

    public int effectiveK(String query) {
        int k = settings.getDefaultK();
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        if (WIDE_TOPICS.matcher(q).find() || COTTAGE_SPECIFIC.matcher(q).find() || GROUP_WORDS.matcher(q).find()) {
            k = Math.max(k, WIDE_K);
        }
        return k;
    }

    /**
     * Turns a follow-up into a standalone question using the recent turns.
     * Without history or a completion service the question is returned unchanged.
     */
    public String refineWithHistory(String question, ChatHistory history) {
        if (history == null || history.isEmpty() || !completionClient.isConfigured()) return question;
        String prompt = """
                Chat History:
                ---------------------
                %s
                ---------------------
                Follow Up Question: %s
                Given the above conversation and a follow up question, rephrase the follow up question to be a standalone question.
                If the follow up names a cottage, keep that cottage. Replace "it", "this cottage" or "that one" with the cottage or \
                property from the chat history. Keep the question about Swiss Cottages Bhurban.
                Standalone question:""".formatted(history.render(), question);
        CompletionResult result = completionClient.generate(prompt, rewriteMaxTokens * 2);
        if (!result.success()) {
            log.warn("Question refinement failed ({}), using the original question", result.failure());
            return question;
        }
        return accept(question, stripPrefixes(result.textOrEmpty())).orElse(question);
    }

    static boolean isComplexQuery(String query) {
        String q = query.toLowerCase(Locale.ROOT);
        long indicators = COMPLEX_INDICATORS.stream().filter(p -> p.matcher(q).find()).count();
        return indicators >= 2 || query.length() > 50 || (COMPLEX_DIGITS.matcher(q).find() && !q.contains("cottage"));
    }

    private String rewrite(String query) {
        String prompt = """
                You are a query optimization assistant for a Swiss Cottages FAQ system.
                Rewrite the user's query to be more effective for semantic search in a knowledge base about \
                Swiss Cottages Bhurban (pricing in PKR, cottages 7, 9 and 11, capacity, facilities, booking, location).
                A number next to people/guests/members is a group size, never a cottage number.
                Only treat a number as a cottage when the word "cottage" precedes it.

                Query: %s
                Optimized query:""".formatted(query);
        CompletionResult result = completionClient.generate(prompt, rewriteMaxTokens);
        if (!result.success()) {
            log.warn("Query rewrite failed ({}), keeping rule-based query", result.failure());
            return query;
        }
        return accept(query, stripPrefixes(result.textOrEmpty())).orElse(query);
    }

    /** Rejects rewrites shorter than three characters or over three times the original length. */
    static Optional<String> accept(String original, String rewritten) {
        if (rewritten == null || rewritten.length() < 3) {
            log.warn("Rewritten query too short, using original");
            return Optional.empty();
        }
        if (rewritten.length() > original.length() * 3) {
            log.warn("Rewritten query suspiciously long ({} vs {}), using original", rewritten.length(), original.length());
            return Optional.empty();
        }
        return Optional.of(rewritten);
    }

    static String stripPrefixes(String text) {
        String out = text.trim();
        for (String prefix : REWRITE_PREFIXES) {
            if (out.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                out = out.substring(prefix.length()).trim();
            }
        }
        return StringUtils.strip(out, "\"'");
    }

    private static Optional<String> cottage(Map<SlotName, Object> turnSlots) {
        if (turnSlots == null) return Optional.empty();
        return turnSlots.get(SlotName.COTTAGE_ID) instanceof String c && !SlotDefinitions.ANY_COTTAGE.equals(c)
                ? Optional.of(c)
                : Optional.empty();
    }
}
