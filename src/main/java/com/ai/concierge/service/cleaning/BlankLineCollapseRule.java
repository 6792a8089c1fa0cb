package com.ai.concierge.service.cleaning;

import java.util.regex.Pattern;

public class BlankLineCollapseRule implements AnswerCleaningRule {

    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    @Override
    public String name() {
        return "blank-lines";
    }

    @Override
    public boolean matches(String text) {
        return BLANK_RUN.matcher(text).find() || !text.equals(text.strip());
    }

    @Override
    public String apply(String text) {
        return BLANK_RUN.matcher(text).replaceAll("\n\n").strip();
    }
}
