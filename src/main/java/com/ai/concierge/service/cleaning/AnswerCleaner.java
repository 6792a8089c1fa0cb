package com.ai.concierge.service.cleaning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans generated answers by running the rules in order: reasoning preamble,
 * template markers, code fences, process lines, blank lines.
 */
@Component
public class AnswerCleaner {

    private static final Logger log = LoggerFactory.getLogger(AnswerCleaner.class);

    private final List<AnswerCleaningRule> rules;

    public AnswerCleaner() {
        this(List.of(
                RegexRemovalRule.reasoningPreamble(),
                new TemplateMarkerRule(),
                new CodeFenceRule(),
                new ProcessLineRule(),
                new BlankLineCollapseRule()));
    }

    AnswerCleaner(List<AnswerCleaningRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public String clean(String answer) {
        if (answer == null || answer.isEmpty()) return "";
        String out = answer;
        List<String> applied = new ArrayList<>();
        for (AnswerCleaningRule rule : rules) {
            if (rule.matches(out)) {
                out = rule.apply(out);
                applied.add(rule.name());
            }
        }
        if (!applied.isEmpty()) log.debug("Answer cleaned by {}", applied);
        return out;
    }

    public List<String> ruleNames() {
        return rules.stream().map(AnswerCleaningRule::name).toList();
    }
}
