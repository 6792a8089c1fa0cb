package com.ai.concierge.service.cleaning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Skips lines where the model talks about its own process, together with the
 * separator or blank lines right after them.
 */
public class ProcessLineRule implements AnswerCleaningRule {

    private static final List<String> PHRASES = List.of(
            "the new context is",
            "since the original",
            "however, there seems",
            "to refine the existing",
            "we have the opportunity",
            "considering the");

    @Override
    public String name() {
        return "process-lines";
    }

    @Override
    public boolean matches(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return PHRASES.stream().anyMatch(lower::contains);
    }

    @Override
    public String apply(String text) {
        List<String> kept = new ArrayList<>();
        boolean skipping = false;
        for (String line : text.split("\n", -1)) {
            String lower = line.toLowerCase(Locale.ROOT).trim();
            if (PHRASES.stream().anyMatch(lower::contains)) {
                skipping = true;
                continue;
            }
            if (skipping && (lower.isEmpty() || lower.equals("---"))) continue;
            skipping = false;
            kept.add(line);
        }
        return String.join("\n", kept);
    }
}
