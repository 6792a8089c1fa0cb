package com.ai.concierge.service;

import com.ai.concierge.TestFixtures;
import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.client.RetrievalClient;
import com.ai.concierge.client.RetrievalFailure;
import com.ai.concierge.client.RetrievalResult;
import com.ai.concierge.component.ResponsePhrases;
import com.ai.concierge.component.SessionRegistry;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.dto.ChatResponse;
import com.ai.concierge.dto.RetrievedDocument;
import com.ai.concierge.service.cleaning.AnswerCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationOrchestratorTest {

    private static final String PRICING_QUESTION = "what is the price of cottage 9 from 3 feb to 5 feb for 4 guests?";

    private static final RetrievedDocument SAFETY_DOC = RetrievedDocument.of(
            "Swiss Cottages Bhurban is a gated community with security guards on duty around the clock.",
            Map.of("source", "safety.md"));

    private static final RetrievedDocument RATES_DOC = RetrievedDocument.of(
            "Cottage 9 costs PKR 33,000 per night on weekdays and PKR 38,000 per night on weekends.",
            Map.of("source", "pricing.md"));

    private CompletionClient completion;
    private RetrievalClient retrieval;
    private SessionRegistry sessions;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ConciergeProperties properties = TestFixtures.properties();
        completion = mock(CompletionClient.class);
        retrieval = mock(RetrievalClient.class);
        sessions = new SessionRegistry(new SlotDefinitions(properties), properties, TestFixtures.CLOCK);

        CottageCatalog catalog = new CottageCatalog(properties);
        NumberExtractor numbers = new NumberExtractor();
        DateExtractor dates = new DateExtractor(TestFixtures.CLOCK);
        TopicDetector topics = new TopicDetector();
        orchestrator = new ConversationOrchestrator(
                sessions,
                new IntentRouter(completion, topics, properties),
                topics,
                new SlotExtractor(numbers, dates, completion, properties),
                numbers,
                catalog,
                new PricingQueryHandler(new PricingCalculator(catalog, properties), catalog, dates, numbers, topics, properties),
                new CapacityHandler(numbers, dates, catalog, properties),
                new RetrievalQueryOptimizer(completion, numbers, properties),
                retrieval,
                new DocumentRelevanceFilter(numbers, topics, catalog),
                new AnswerPromptBuilder(catalog),
                completion,
                new AnswerCleaner(),
                new RecommendationEngine(catalog, properties),
                new ResponsePhrases(properties),
                properties);
    }

    @Test
    void greetingGetsCannedReplyWithoutRetrieval() {
        ChatResponse response = orchestrator.process("s1", "hi", null, null);

        assertEquals(ChatResponse.Type.GREETING, response.getType());
        assertTrue(response.getAnswer().startsWith("Hi!"));
        assertEquals("s1", response.getSessionId());
        assertEquals(1, sessions.find("s1").orElseThrow().getHistory().turns().size());
        verify(retrieval, never()).search(anyString(), anyInt(), anyMap());
    }

    @Test
    void pricingQuestionPutsComputedBreakdownInFrontOfTheContext() {
        when(retrieval.search(anyString(), anyInt(), anyMap())).thenReturn(RetrievalResult.of(List.of(RATES_DOC)));
        when(completion.generate(anyString(), anyInt())).thenReturn(CompletionResult.success("Your stay costs PKR 66,000."));

        ChatResponse response = orchestrator.process("s1", PRICING_QUESTION, null, null);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(completion).generate(prompt.capture(), anyInt());
        assertTrue(prompt.getValue().contains("PRICING CALCULATION FOR COTTAGE 9"));
        assertTrue(prompt.getValue().contains("Total Cost: PKR 66,000"));
        assertTrue(prompt.getValue().indexOf("PRICING CALCULATION") < prompt.getValue().indexOf("Cottage 9 costs"));

        assertEquals(ChatResponse.Type.ANSWER, response.getType());
        assertTrue(response.getAnswer().startsWith("Your stay costs PKR 66,000."));
        assertEquals(4, response.getSlots().get("guests"));
        assertEquals("9", response.getSlots().get("cottage_id"));
        assertEquals(1, response.getSources().size());
    }

    @Test
    void retrievalOutageStillAnswersComputedPrices() {
        when(retrieval.search(anyString(), anyInt(), anyMap()))
                .thenReturn(RetrievalResult.failure(RetrievalFailure.TRANSPORT, "connection refused"));

        ChatResponse response = orchestrator.process("s1", PRICING_QUESTION, null, null);

        assertEquals(ChatResponse.Type.ANSWER, response.getType());
        assertTrue(response.getAnswer().contains("Total Cost: PKR 66,000"));
        assertFalse(response.getAnswer().contains("PRICING CALCULATION"));
        verify(completion, never()).generate(anyString(), anyInt());
    }

    @Test
    void retrievalOutageWithoutPricesIsUnavailable() {
        when(retrieval.search(anyString(), anyInt(), anyMap()))
                .thenReturn(RetrievalResult.failure(RetrievalFailure.TRANSPORT, "connection refused"));

        ChatResponse response = orchestrator.process("s1", "is it safe?", null, null);

        assertEquals(ChatResponse.Type.UNAVAILABLE, response.getType());
        assertTrue(response.getAnswer().contains("+92 300 1218563"));
    }

    @Test
    void questionsAboutOtherCountriesAreOutOfScope() {
        when(retrieval.search(anyString(), anyInt(), anyMap())).thenReturn(RetrievalResult.of(List.of(RetrievedDocument.of(
                "Swiss Cottages Bhurban is located in Murree, Pakistan.", Map.of("source", "location.md")))));

        ChatResponse response = orchestrator.process("s1", "do you have cottages in india?", null, null);

        assertEquals(ChatResponse.Type.OUT_OF_SCOPE, response.getType());
        assertTrue(response.getAnswer().contains("do you have cottages in india?"));
        verify(completion, never()).generate(anyString(), anyInt());
    }

    @Test
    void emptyRetrievalRetriesWithOriginalQuestion() {
        when(retrieval.search(anyString(), anyInt(), anyMap())).thenReturn(RetrievalResult.of(List.of()));

        ChatResponse response = orchestrator.process("s1", "is it safe?", null, null);

        assertEquals(ChatResponse.Type.NO_DOCUMENTS, response.getType());
        verify(retrieval).search("is it safe?", 3, Map.of());
    }

    @Test
    @SuppressWarnings("unchecked")
    void streamingHandsOutChunksAndReturnsCleanedAnswer() {
        when(retrieval.search(anyString(), anyInt(), anyMap())).thenReturn(RetrievalResult.of(List.of(SAFETY_DOC)));
        when(completion.stream(anyString(), anyInt(), any(Consumer.class))).thenAnswer(invocation -> {
            Consumer<String> sink = invocation.getArgument(2);
            sink.accept("Yes, ");
            sink.accept("it is a gated community.");
            return CompletionResult.success("Yes, it is a gated community.");
        });
        List<String> chunks = new ArrayList<>();

        ChatResponse response = orchestrator.stream("s1", "is it safe?", null, null, chunks::add);

        assertEquals("Yes, ", chunks.get(0));
        assertEquals("it is a gated community.", chunks.get(1));
        assertTrue(chunks.get(2).contains("**Tip:**"));
        assertTrue(response.getAnswer().startsWith("Yes, it is a gated community."));
        assertEquals(String.join("", chunks), response.getAnswer());
    }

    @Test
    void directBookingRequests() {
        assertTrue(ConversationOrchestrator.isDirectBookingRequest("please book cottage 9 for us"));
        assertTrue(ConversationOrchestrator.isDirectBookingRequest("book this one"));
        assertFalse(ConversationOrchestrator.isDirectBookingRequest("how does booking work"));
        assertFalse(ConversationOrchestrator.isDirectBookingRequest("can you tell me the price"));
    }
}
