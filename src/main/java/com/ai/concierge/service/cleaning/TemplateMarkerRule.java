package com.ai.concierge.service.cleaning;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips what leaks from the structured pricing and capacity analyses into
 * an answer: their upper-case section headers and the directives addressed
 * to the answer writer. The figures around them are kept.
 */
public class TemplateMarkerRule implements AnswerCleaningRule {

    private static final Pattern HEADER = Pattern.compile(
            "(?m)^\\s*(?:PRICING CALCULATION FOR COTTAGE \\d+|PRICING INFORMATION(?: FOR COTTAGE \\d+)?"
                    + "|CAPACITY CHECK:[^\\n]*|COTTAGE \\d+ CAPACITY|COTTAGE CAPACITY OVERVIEW)\\s*$\\n?");

    private static final List<Pattern> DIRECTIVES = List.of(
            Pattern.compile("Use these exact figures in the answer\\.\\s*"),
            Pattern.compile("Do not (?:recalculate|assume|invent|quote)[^.\\n]*\\.\\s*"),
            Pattern.compile("Ask the guest (?:for|to)[^.\\n]*\\.\\s*"),
            Pattern.compile("Ask which cottage the guest is interested in[^\\n]*\\.\\s*"));

    @Override
    public String name() {
        return "template-markers";
    }

    @Override
    public boolean matches(String text) {
        return HEADER.matcher(text).find() || DIRECTIVES.stream().anyMatch(p -> p.matcher(text).find());
    }

    @Override
    public String apply(String text) {
        String out = HEADER.matcher(text).replaceAll("");
        for (Pattern directive : DIRECTIVES) {
            out = directive.matcher(out).replaceAll("");
        }
        return out;
    }
}
