package com.ai.concierge.service.cleaning;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnswerCleaningRulesTest {

    @Test
    void reasoningPreambleIsRemoved() {
        AnswerCleaningRule rule = RegexRemovalRule.reasoningPreamble();

        assertTrue(rule.matches("Based on the provided context, Cottage 9 has a kitchen."));
        assertEquals("Cottage 9 has a kitchen.", rule.apply("Based on the provided context, Cottage 9 has a kitchen."));
        assertEquals("The cottages have WiFi.", rule.apply("Answer: The cottages have WiFi."));
        assertFalse(rule.matches("The cottages have WiFi."));
    }

    @Test
    void templateHeadersAndDirectivesAreRemoved() {
        AnswerCleaningRule rule = new TemplateMarkerRule();
        String leaked = "PRICING CALCULATION FOR COTTAGE 9\n"
                + "Stay: February 3, 2026 to February 5, 2026 (2 nights)\n"
                + "Use these exact figures in the answer. Do not recalculate or change the dates.";

        assertTrue(rule.matches(leaked));
        assertEquals("Stay: February 3, 2026 to February 5, 2026 (2 nights)", rule.apply(leaked).strip());
    }

    @Test
    void askDirectiveIsRemovedButGuestFacingQuestionStays() {
        AnswerCleaningRule rule = new TemplateMarkerRule();

        String out = rule.apply("Ask the guest for their dates. Which dates are you planning to visit?");

        assertEquals("Which dates are you planning to visit?", out);
        assertFalse(rule.matches("Which dates are you planning to visit?"));
    }

    @Test
    void codeFencesAreDropped() {
        AnswerCleaningRule rule = new CodeFenceRule();

        assertEquals("Here:\n\nDone", rule.apply("Here:\n```json\n{\"a\": 1}\n```\nDone"));
        assertFalse(rule.matches("no code here"));
    }

    @Test
    void processLinesAndTheirSeparatorsAreSkipped() {
        AnswerCleaningRule rule = new ProcessLineRule();
        String text = "The new context is as follows\n---\n\nCottage 9 has WiFi.\n\nEnjoy your stay.";

        assertTrue(rule.matches(text));
        assertEquals("Cottage 9 has WiFi.\n\nEnjoy your stay.", rule.apply(text));
    }

    @Test
    void blankRunsCollapse() {
        AnswerCleaningRule rule = new BlankLineCollapseRule();

        assertEquals("a\n\nb", rule.apply("a\n\n\n\nb  "));
        assertFalse(rule.matches("a\n\nb"));
    }
}
