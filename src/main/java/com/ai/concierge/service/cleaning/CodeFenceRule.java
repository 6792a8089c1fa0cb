package com.ai.concierge.service.cleaning;

import java.util.regex.Pattern;

/**
 * Drops fenced code blocks; guests never need them.
 */
public class CodeFenceRule implements AnswerCleaningRule {

    private static final Pattern FENCE = Pattern.compile("```.*?```", Pattern.DOTALL);

    @Override
    public String name() {
        return "code-fence";
    }

    @Override
    public boolean matches(String text) {
        return text.contains("```");
    }

    @Override
    public String apply(String text) {
        return FENCE.matcher(text).replaceAll("");
    }
}
