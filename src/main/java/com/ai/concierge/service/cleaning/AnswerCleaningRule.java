package com.ai.concierge.service.cleaning;

/**
 * One step of answer cleaning. Rules are applied in a fixed order and only
 * when {@link #matches(String)} says there is something to clean.
 */
public interface AnswerCleaningRule {

    String name();

    boolean matches(String text);

    String apply(String text);
}
