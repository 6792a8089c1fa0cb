package com.ai.concierge.service;

import com.ai.concierge.TestFixtures;
import com.ai.concierge.dto.RetrievedDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRelevanceFilterTest {

    private final DocumentRelevanceFilter filter = new DocumentRelevanceFilter(
            new NumberExtractor(), new TopicDetector(), new CottageCatalog(TestFixtures.properties()));

    private static RetrievedDocument doc(String content) {
        return RetrievedDocument.of(content, Map.of("source", "faq.md"));
    }

    @Test
    void safetyPassageStaysFirstEvenWhenItMentionsRates() {
        RetrievedDocument general = doc("Guests enjoy mountain views from the terrace.");
        RetrievedDocument safety = doc("The gated community has security guards; rates include round-the-clock security.");

        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(List.of(general, safety), "is it safe?");

        assertTrue(outcome.accepted());
        assertEquals(List.of(safety, general), outcome.documents());
    }

    @Test
    void pricingPassagesGoLastForNonPricingQuestions() {
        RetrievedDocument pricing = doc("Cottage 9 costs PKR 33,000 per night on weekdays.");
        RetrievedDocument kitchen = doc("Each cottage has a fully equipped kitchen.");

        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(
                List.of(pricing, kitchen), "do you have a kitchen");

        assertEquals(List.of(kitchen, pricing), outcome.documents());
    }

    @Test
    void questionAboutIndiaIsRejected() {
        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(
                List.of(doc("Swiss Cottages Bhurban is in Murree, Pakistan.")), "swiss cottages in india");

        assertFalse(outcome.accepted());
        assertTrue(outcome.documents().isEmpty());
        assertTrue(outcome.reason().contains("india"));
    }

    @Test
    void passagesAboutOtherCottagesAreDropped() {
        RetrievedDocument eleven = doc("Cottage 11 has three bedrooms.");
        RetrievedDocument nine = doc("Cottage 9 has a large terrace.");
        RetrievedDocument general = doc("Check-in is at 2 pm.");

        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(
                List.of(eleven, general, nine), "tell me about cottage 9");

        assertEquals(List.of(nine, general), outcome.documents());
    }

    @Test
    void hiddenCottageOnlyWhenAskedFor() {
        RetrievedDocument seven = RetrievedDocument.of("Two bedrooms and a lounge.", Map.of("cottage_id", "7"));

        assertTrue(filter.filterAndPrioritize(List.of(seven), "tell me about the cottages").documents().isEmpty());
        assertEquals(List.of(seven), filter.filterAndPrioritize(List.of(seven), "do you have a 2 bedroom cottage").documents());
        assertEquals(List.of(seven), filter.filterAndPrioritize(List.of(seven), "what about cottage 7").documents());
    }

    @Test
    void capacityQuestionPrefersCottagePassages() {
        RetrievedDocument general = doc("The property is surrounded by pine forest.");
        RetrievedDocument nine = doc("Cottage 9 sleeps up to 6 guests.");

        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(
                List.of(general, nine), "which cottage is best for 6 people");

        assertEquals(nine, outcome.documents().get(0));
    }

    @Test
    void nothingToFilter() {
        DocumentRelevanceFilter.FilterOutcome outcome = filter.filterAndPrioritize(List.of(), "anything");

        assertTrue(outcome.accepted());
        assertTrue(outcome.documents().isEmpty());
    }
}
