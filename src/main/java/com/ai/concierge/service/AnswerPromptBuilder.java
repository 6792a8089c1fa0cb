package com.ai.concierge.service;

import com.ai.concierge.conversation.Intent;
import com.ai.concierge.dto.RetrievedDocument;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the answer-generation prompt from the filtered context and the
 * guest's question, with a few topic-specific rules.
 */
@Component
public class AnswerPromptBuilder {

    private static final Map<Intent, String> TOPIC_RULES = new EnumMap<>(Intent.class);

    static {
        TOPIC_RULES.put(Intent.PRICING,
                "- If the context starts with a pricing calculation, present its figures and dates exactly as given\n"
                        + "- If dates are missing, ask the guest for them instead of assuming any");
        TOPIC_RULES.put(Intent.SAFETY,
                "- Talk about security, guards and the gated community\n"
                        + "- Do not mention prices");
        TOPIC_RULES.put(Intent.ROOMS,
                "- If the context starts with a capacity check, follow its verdict\n"
                        + "- Mention bedrooms and occupancy limits only as stated in the context");
        TOPIC_RULES.put(Intent.FACILITIES, "- List only facilities that appear in the context");
        TOPIC_RULES.put(Intent.LOCATION,
                "- Swiss Cottages is adjacent to Pearl Continental (PC) Bhurban in the Murree Hills, Pakistan");
        TOPIC_RULES.put(Intent.AVAILABILITY,
                "- Do not confirm availability for specific dates; suggest contacting the cottage manager");
        TOPIC_RULES.put(Intent.BOOKING, "- Explain the booking steps and payment methods found in the context");
    }

    private final CottageCatalog catalog;

    public AnswerPromptBuilder(CottageCatalog catalog) {
        this.catalog = catalog;
    }

    public String build(String question, Intent intent, List<RetrievedDocument> documents) {
        String context = documents.stream()
                .map(RetrievedDocument::content)
                .collect(Collectors.joining("\n\n"));
        String cottages = catalog.all().stream()
                .map(CottageCatalog.Cottage::number)
                .collect(Collectors.joining(", "));
        StringBuilder rules = new StringBuilder()
                .append("- Answer using ONLY the context provided above\n")
                .append("- The property is called Swiss Cottages Bhurban, in Bhurban, Murree, Pakistan\n")
                .append("- Only these cottages exist: ").append(cottages).append('\n')
                .append("- Do not invent URLs, prices or dates\n")
                .append("- Be concise and conversational\n");
        if (intent != Intent.PRICING && intent != Intent.BOOKING) {
            rules.append("- Do not mention pricing unless the question asks about it\n");
        }
        String topic = TOPIC_RULES.get(intent);
        if (topic != null) rules.append(topic).append('\n');

        return "Context information is below.\n"
                + "---------------------\n"
                + context + "\n"
                + "---------------------\n\n"
                + "RULES:\n" + rules + "\n"
                + "Question: " + question + "\n"
                + "Answer:";
    }
}
