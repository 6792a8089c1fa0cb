package com.ai.concierge.service;

import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.client.RetrievalClient;
import com.ai.concierge.client.RetrievalResult;
import com.ai.concierge.component.ResponsePhrases;
import com.ai.concierge.component.SessionRegistry;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.ChatHistory;
import com.ai.concierge.conversation.ContextTracker;
import com.ai.concierge.conversation.Intent;
import com.ai.concierge.conversation.Session;
import com.ai.concierge.conversation.SlotManager;
import com.ai.concierge.conversation.SlotName;
import com.ai.concierge.dto.ChatResponse;
import com.ai.concierge.dto.PricingResult;
import com.ai.concierge.dto.RetrievedDocument;
import com.ai.concierge.dto.SourceInfo;
import com.ai.concierge.service.cleaning.AnswerCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Single entry for a chat turn: classifies the message, answers canned intents
 * directly, and for information questions runs slot extraction, structured
 * pricing/capacity analysis, retrieval, relevance filtering and answer
 * generation. The whole turn runs under the session lock.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private static final Pattern FOLLOW_UP_STATEMENT = Pattern.compile(
            "\\b(?:but (?:we|i|they|which|what|how|when|where|can|is|are|do|does|will|would)|we are|we have|we need|we want"
                    + "|which cottage|what cottage)\\b");

    private static final Pattern BOOKING_VERB = Pattern.compile("\\b(?:book|reserve|reservation)\\b");
    private static final Pattern BOOKING_REQUEST = Pattern.compile("\\b(?:for me|for us|i want|i need|can you|please)\\b");
    private static final Pattern BOOKING_IMPERATIVE = Pattern.compile("^(?:book|reserve)\\s|\\bbook (?:this|that|one)\\b");

    private final SessionRegistry sessions;
    private final IntentRouter intentRouter;
    private final TopicDetector topicDetector;
    private final SlotExtractor slotExtractor;
    private final NumberExtractor numberExtractor;
    private final CottageCatalog catalog;
    private final PricingQueryHandler pricingHandler;
    private final CapacityHandler capacityHandler;
    private final RetrievalQueryOptimizer queryOptimizer;
    private final RetrievalClient retrievalClient;
    private final DocumentRelevanceFilter relevanceFilter;
    private final AnswerPromptBuilder promptBuilder;
    private final CompletionClient completionClient;
    private final AnswerCleaner answerCleaner;
    private final RecommendationEngine recommendations;
    private final ResponsePhrases phrases;
    private final ConciergeProperties properties;

    public ConversationOrchestrator(SessionRegistry sessions,
                                    IntentRouter intentRouter,
                                    TopicDetector topicDetector,
                                    SlotExtractor slotExtractor,
                                    NumberExtractor numberExtractor,
                                    CottageCatalog catalog,
                                    PricingQueryHandler pricingHandler,
                                    CapacityHandler capacityHandler,
                                    RetrievalQueryOptimizer queryOptimizer,
                                    RetrievalClient retrievalClient,
                                    DocumentRelevanceFilter relevanceFilter,
                                    AnswerPromptBuilder promptBuilder,
                                    CompletionClient completionClient,
                                    AnswerCleaner answerCleaner,
                                    RecommendationEngine recommendations,
                                    ResponsePhrases phrases,
                                    ConciergeProperties properties) {
        this.sessions = sessions;
        this.intentRouter = intentRouter;
        this.topicDetector = topicDetector;
        this.slotExtractor = slotExtractor;
        this.numberExtractor = numberExtractor;
        this.catalog = catalog;
        this.pricingHandler = pricingHandler;
        this.capacityHandler = capacityHandler;
        this.queryOptimizer = queryOptimizer;
        this.retrievalClient = retrievalClient;
        this.relevanceFilter = relevanceFilter;
        this.promptBuilder = promptBuilder;
        this.completionClient = completionClient;
        this.answerCleaner = answerCleaner;
        this.recommendations = recommendations;
        this.phrases = phrases;
        this.properties = properties;
    }

    public ChatResponse process(String sessionId, String question, Integer k, Integer maxTokens) {
        return sessions.withSession(sessionId, session -> runTurn(session, question, k, maxTokens, null));
    }

    /**
     * Same as {@link #process} but hands answer text to {@code onChunk} as it
     * is produced. The returned response carries the cleaned final answer.
     */
    public ChatResponse stream(String sessionId, String question, Integer k, Integer maxTokens, Consumer<String> onChunk) {
        return sessions.withSession(sessionId, session -> runTurn(session, question, k, maxTokens, onChunk));
    }

    private ChatResponse runTurn(Session session, String question, Integer k, Integer maxTokens, Consumer<String> onChunk) {
        String sessionId = session.getId();
        ChatHistory history = session.getHistory();
        ContextTracker context = session.getContext();
        String q = question.trim().toLowerCase(Locale.ROOT);

        Intent intent = intentRouter.classify(question, history);
        if (intent == Intent.STATEMENT && FOLLOW_UP_STATEMENT.matcher(q).find()) {
            intent = topicDetector.detect(q).orElse(Intent.FAQ_QUESTION);
            log.info("[{}] Statement treated as follow-up question ({})", sessionId, intent);
        }
        context.addIntent(intent);
        log.info("[{}] Intent {} for '{}'", sessionId, intent, question);

        boolean offeredMore = IntentRouter.askedAnythingElse(history);
        switch (intent) {
            case GREETING:
                return canned(session, question, intent, ChatResponse.Type.GREETING, phrases.greeting(), onChunk);
            case HELP:
                return canned(session, question, intent, ChatResponse.Type.HELP, phrases.help(), onChunk);
            case AFFIRMATIVE:
                return canned(session, question, intent, ChatResponse.Type.ACKNOWLEDGEMENT, phrases.affirmative(offeredMore), onChunk);
            case NEGATIVE:
                return canned(session, question, intent, ChatResponse.Type.ACKNOWLEDGEMENT, phrases.negative(offeredMore), onChunk);
            case STATEMENT:
                return canned(session, question, intent, ChatResponse.Type.ACKNOWLEDGEMENT, phrases.thanks(), onChunk);
            case CLARIFICATION_NEEDED:
                return canned(session, question, intent, ChatResponse.Type.CLARIFY,
                        phrases.clarify(intentRouter.getClarificationQuestion(question)), onChunk);
            default:
                return answerQuestion(session, question, q, intent, k, maxTokens, onChunk);
        }
    }

    private ChatResponse answerQuestion(Session session, String question, String q, Intent intent,
                                        Integer k, Integer maxTokens, Consumer<String> onChunk) {
        String sessionId = session.getId();
        ChatHistory history = session.getHistory();
        ContextTracker context = session.getContext();
        SlotManager slots = session.getSlots();

        Map<SlotName, Object> extracted = slotExtractor.extractSlots(question, intent, slots);
        List<SlotName> changed = slots.updateSlots(extracted);
        for (SlotName name : changed) {
            Object value = slots.getSlot(name);
            if (value != null) context.setPreference(name.key(), value);
        }
        Optional<String> namedCottage = numberExtractor.extractCottageNumber(q).filter(catalog::exists);
        namedCottage.ifPresent(slots::noteCottageMention);
        Map<SlotName, Object> turnSlots = slots.slotsForTurn(q, intent, namedCottage);
        if (slots.hasEnoughBookingInfo() || context.isReadyToBook()) {
            context.markReadyToBook();
        }

        String refined = queryOptimizer.refineWithHistory(question, history);
        String retrievalQuery = queryOptimizer.optimize(refined, intent, turnSlots);
        int effectiveK = k != null && k > 0 ? k : queryOptimizer.effectiveK(refined);
        Map<String, String> filter = queryOptimizer.retrievalFilter(intent, turnSlots);

        RetrievalResult retrieval = retrievalClient.search(retrievalQuery, effectiveK, filter);
        if (retrieval.success() && retrieval.isEmpty()
                && Boolean.TRUE.equals(properties.getRetrieval().getFallbackToOriginalQuery())
                && !retrievalQuery.equals(question)) {
            log.info("[{}] No documents for '{}', retrying with the original question", sessionId, retrievalQuery);
            retrieval = retrievalClient.search(question, effectiveK, Map.of());
        }
        List<RetrievedDocument> retrieved = retrieval.success() ? retrieval.documents() : List.of();

        PricingResult pricing = null;
        CapacityHandler.CapacityResult capacity = null;
        if (intent == Intent.PRICING || pricingHandler.isPricingQuery(q)) {
            pricing = pricingHandler.processPricingQuery(question, turnSlots, retrieved);
            log.info("[{}] Pricing outcome {} missing={}", sessionId, pricing.status(), pricing.missingSlots());
            if (pricing.hasAllInfo()) {
                context.addKeyPoint("Quoted cottage " + pricing.cottage() + ": PKR " + PricingCalculator.pkr(pricing.totalPrice()));
            }
        } else if (capacityHandler.isCapacityQuery(q)) {
            capacity = capacityHandler.processCapacityQuery(question, turnSlots);
            log.info("[{}] Capacity check group={} cottage={} suitable={}", sessionId,
                    capacity.groupSize(), capacity.cottage(), capacity.suitable());
        }

        if (!retrieval.success()) {
            log.warn("[{}] Retrieval failed ({}): {}", sessionId, retrieval.failure(), retrieval.message());
            if (pricing != null && pricing.hasAllInfo()) {
                return finish(session, question, refined, intent, answerCleaner.clean(pricing.template()),
                        List.of(), turnSlots, onChunk);
            }
            return canned(session, question, intent, ChatResponse.Type.UNAVAILABLE, phrases.unavailable(), onChunk);
        }

        DocumentRelevanceFilter.FilterOutcome outcome = relevanceFilter.filterAndPrioritize(retrieved, question);
        if (!outcome.accepted()) {
            return canned(session, question, intent, ChatResponse.Type.OUT_OF_SCOPE,
                    phrases.outOfScope(question, outcome.reason()), onChunk);
        }
        List<RetrievedDocument> documents = outcome.documents();
        List<SourceInfo> sources = documents.stream().limit(effectiveK).map(SourceInfo::from).toList();
        if (pricing != null) documents = pricingHandler.enhanceContext(documents, pricing);
        if (capacity != null) documents = capacityHandler.enhanceContext(documents, capacity);
        if (documents.isEmpty()) {
            log.info("[{}] No relevant documents for '{}'", sessionId, question);
            return canned(session, question, intent, ChatResponse.Type.NO_DOCUMENTS, phrases.noDocuments(), onChunk);
        }

        boolean bookingRequest = isDirectBookingRequest(q);
        if (bookingRequest) emit(onChunk, phrases.bookingAcknowledgement());

        String prompt = promptBuilder.build(refined, intent, documents);
        int tokens = maxTokens != null && maxTokens > 0 ? maxTokens : properties.getCompletion().getAnswerMaxTokens();
        CompletionResult generated = onChunk == null
                ? completionClient.generate(prompt, tokens)
                : completionClient.stream(prompt, tokens, onChunk);

        String answer;
        if (generated.success()) {
            answer = answerCleaner.clean(generated.text());
            if (answer.isBlank()) answer = phrases.emptyAnswer();
        } else if (pricing != null && pricing.hasAllInfo()) {
            log.warn("[{}] Answer generation failed ({}), returning the computed breakdown", sessionId, generated.failure());
            answer = answerCleaner.clean(pricing.template());
            emit(onChunk, answer);
        } else {
            log.warn("[{}] Answer generation failed ({}): {}", sessionId, generated.failure(), generated.message());
            return canned(session, question, intent, ChatResponse.Type.UNAVAILABLE, phrases.unavailable(), onChunk);
        }

        if (bookingRequest) {
            answer = phrases.bookingAcknowledgement() + answer + phrases.bookingNextSteps();
            emit(onChunk, phrases.bookingNextSteps());
        }
        String extras = extras(question, intent, turnSlots, context);
        if (!extras.isEmpty()) {
            answer = answer + "\n\n" + extras;
            emit(onChunk, "\n\n" + extras);
        }
        return finishAnswer(session, question, refined, intent, answer, sources, turnSlots);
    }

    private String extras(String question, Intent intent, Map<SlotName, Object> turnSlots, ContextTracker context) {
        List<String> parts = new ArrayList<>();
        recommendations.generateGentleRecommendation(intent, turnSlots).ifPresent(parts::add);
        recommendations.generateCrossRecommendation(question, intent).ifPresent(parts::add);
        recommendations.generateAlternativeSuggestion(intent, turnSlots).ifPresent(parts::add);
        recommendations.generateImageRecommendation(question, turnSlots, intent).ifPresent(parts::add);
        recommendations.generateBookingNudge(turnSlots, context, intent)
                .or(() -> recommendations.generateProactiveSuggestion(context, turnSlots))
                .ifPresent(parts::add);
        return String.join("\n\n", parts);
    }

    private ChatResponse finish(Session session, String question, String refined, Intent intent, String answer,
                                List<SourceInfo> sources, Map<SlotName, Object> turnSlots, Consumer<String> onChunk) {
        emit(onChunk, answer);
        return finishAnswer(session, question, refined, intent, answer, sources, turnSlots);
    }

    private ChatResponse finishAnswer(Session session, String question, String refined, Intent intent, String answer,
                                      List<SourceInfo> sources, Map<SlotName, Object> turnSlots) {
        ContextTracker context = session.getContext();
        session.getHistory().append(refined, answer);
        context.addToSummary(intent.key() + ": " + question);
        List<String> suggestions = recommendations.generateContextualSuggestions(
                question, intent, context, session.getHistory());
        log.debug("[{}] Answered {} with {} sources", session.getId(), intent, sources.size());
        return ChatResponse.answer(answer, intent.key(), session.getId(), sources, suggestions,
                session.getSlots().toKeyMap());
    }

    private ChatResponse canned(Session session, String question, Intent intent, ChatResponse.Type type,
                                String answer, Consumer<String> onChunk) {
        emit(onChunk, answer);
        session.getHistory().append(question, answer);
        log.debug("[{}] Canned {} reply", session.getId(), type);
        return ChatResponse.of(type, answer, intent.key(), session.getId())
                .withSlots(session.getSlots().toKeyMap());
    }

    static boolean isDirectBookingRequest(String q) {
        boolean verb = BOOKING_VERB.matcher(q).find();
        return verb && (BOOKING_REQUEST.matcher(q).find() || BOOKING_IMPERATIVE.matcher(q).find());
    }

    private static void emit(Consumer<String> onChunk, String text) {
        if (onChunk != null && text != null && !text.isEmpty()) onChunk.accept(text);
    }
}
