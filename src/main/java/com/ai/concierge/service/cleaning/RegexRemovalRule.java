package com.ai.concierge.service.cleaning;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes every match of a list of patterns.
 */
public class RegexRemovalRule implements AnswerCleaningRule {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private final String name;
    private final List<Pattern> patterns;

    public RegexRemovalRule(String name, List<Pattern> patterns) {
        this.name = name;
        this.patterns = List.copyOf(patterns);
    }

    /** Narration models put in front of the answer ("Based on the provided context, ..."). */
    public static RegexRemovalRule reasoningPreamble() {
        return new RegexRemovalRule("reasoning-preamble", List.of(
                Pattern.compile("However, there seems to be missing context.*?\\.\\s*", FLAGS),
                Pattern.compile("Since the original context is now provided.*?\\.\\s*", FLAGS),
                Pattern.compile("The new context is as follows:.*?---\\s*", FLAGS),
                Pattern.compile("Since the question and the answer already match.*?\\.\\s*", FLAGS),
                Pattern.compile("Therefore, I'll leave the answer as it is\\.\\s*", FLAGS),
                Pattern.compile("Refined Answer:\\s*", FLAGS),
                Pattern.compile("^\\s*Answer:\\s*", FLAGS),
                Pattern.compile("Based on the provided context.*?[.,]\\s*", FLAGS),
                Pattern.compile("Given the context.*?[.,]\\s*", FLAGS),
                Pattern.compile("Based on the existing answer and the new context.*?\\.\\s*", FLAGS),
                Pattern.compile("We have the opportunity to refine.*?\\.\\s*", FLAGS),
                Pattern.compile("To refine the existing answer.*?\\.\\s*", FLAGS),
                Pattern.compile("Considering[^.]*?the refined answer.*?\\.\\s*", FLAGS)));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean matches(String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    @Override
    public String apply(String text) {
        String out = text;
        for (Pattern pattern : patterns) {
            out = pattern.matcher(out).replaceAll("");
        }
        return out;
    }
}
