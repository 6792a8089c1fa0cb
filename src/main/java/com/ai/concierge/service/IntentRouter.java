package com.ai.concierge.service;

import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.client.CompletionResult;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.ChatHistory;
import com.ai.concierge.conversation.Intent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-first intent classifier.
 * <p>
 * Rules run in a fixed order and the first that decides wins; short leftovers
 * may go to the completion service. Anything still undecided is treated as an
 * information request. Information requests are then narrowed to a topic
 * (pricing, safety, ...) by keyword.
 * </p>
 */
@Service
public class IntentRouter {

    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);

    private static final Pattern GREETING = Pattern.compile(
            "^(?:hi+|hello|hey+|greetings|good morning|good afternoon|good evening|hlo|helo|hiya|howdy|sup|yo|salam|assalam o alaikum)\\b(?:\\s+there)?");

    private static final Pattern QUESTION_WORDS = Pattern.compile(
            "\\b(?:what|where|when|who|why|how|which|tell|show|explain|describe|list|can|do|does|is|are)\\b|\\?");

    private static final Pattern FOLLOW_UP_START = Pattern.compile("^(?:and|but|if|also|or|what about|how about)\\s+(.*)$");

    private static final Pattern HOW_TO = Pattern.compile("\\bhow to\\b");

    private static final Pattern HELP = Pattern.compile(
            "\\b(?:how can you (?:help|assist)|what can you (?:help|do)|how do you help|what do you do|how can i|what help"
                    + "|can you (?:help|assist))\\b");

    private static final Pattern FOR_ABOUT_CONTENT = Pattern.compile("\\b(?:for|about|with)\\s+\\w+\\s+\\w+");

    private static final Pattern TOPIC_KEYWORDS = Pattern.compile(
            "\\b(?:pricing|price|prices|cost|rates?|location|address|where|facilities|amenities|features|booking|book"
                    + "|reservation|payment|pay|methods|availability|available|cottages?|safe|safety|security)\\b");

    private static final Pattern CONFIRMATION = Pattern.compile(
            "^(?:so (?:it|they|that|this|these)\\b|i see\\b|i understand\\b|got it\\b|makes sense\\b|that's clear\\b|that makes sense\\b)");

    private static final Pattern THANKS_LIKE = Pattern.compile("\\b(?:thanks|thank you|thank|thx|appreciate)\\b");

    private static final Pattern ACTION_VERBS = Pattern.compile(
            "\\b(?:book|reserve|want|need|looking|interested|get|find|check|stay|visit|bring)\\b");

    private static final Pattern DIGITS = Pattern.compile("\\d");

    private static final Pattern ANYTHING_ELSE = Pattern.compile(
            "\\b(?:is there anything else|anything else you'd like|anything else you would like|what else|anything else)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern VAGUE_PRICE = Pattern.compile("\\b(?:price|pricing|cost|how much|rates?)\\b");
    private static final Pattern PRICE_CONTEXT = Pattern.compile("\\b(?:cottages?|swiss|property|stay|booking|rent|night|nights|weekdays?|weekends?|\\d+)\\b");
    private static final Pattern VAGUE_FACILITIES = Pattern.compile("\\b(?:facilities|amenities|what is available|what do you have)\\b");
    private static final Pattern FACILITY_CONTEXT = Pattern.compile("\\b(?:cottages?|rooms?|kitchen|parking|bbq|wifi|available|what)\\b");

    private static final Set<String> NEGATIVES = Set.of(
            "no", "nope", "nah", "not really", "nothing", "nothing else", "no thanks", "no thank you", "not now");

    private static final Set<String> AFFIRMATIVES = Set.of("yes", "yeah", "yep", "yup", "sure", "yes please", "sure thing");

    private static final List<String> STATEMENTS = List.of(
            "great", "good", "nice", "awesome", "excellent", "perfect", "wonderful", "thanks", "thank you", "thx", "thank",
            "appreciate it", "ok", "okay", "alright", "fine", "got it", "understood", "that's helpful", "that helps",
            "helpful", "useful", "good to know", "i see", "i understand", "cool", "nice one", "well done", "ok thanks",
            "okay thanks", "great thanks");

    private static final Set<String> STATEMENT_FILLERS = Set.of("a lot", "so much", "very much", "again", "buddy", "!", "");

    private static final List<String> ACKNOWLEDGEMENTS = List.of(
            "thanks", "thank you", "thank", "okay", "great", "perfect", "understood", "got it", "alright", "awesome");

    private static final Set<String> PREPOSITIONS = Set.of("for", "about", "with", "in", "on", "at", "to", "from");

    private final CompletionClient completionClient;
    private final TopicDetector topicDetector;
    private final Intent defaultIntent;
    private final int classificationMaxTokens;

    public IntentRouter(CompletionClient completionClient, TopicDetector topicDetector, ConciergeProperties properties) {
        this.completionClient = completionClient;
        this.topicDetector = topicDetector;
        this.defaultIntent = properties.getDefaults().getIntent();
        this.classificationMaxTokens = properties.getCompletion().getClassificationMaxTokens();
    }

    public Intent classify(String query, ChatHistory history) {
        if (StringUtils.isBlank(query)) return defaultIntent;
        String q = normalize(query);
        Intent act = classifyAct(q, query, history);
        Intent intent = refine(act, q, history);
        log.debug("Classified '{}' as {} (dialogue act {})", query, intent, act);
        return intent;
    }

    /** Greeting, help, acknowledgement or information request. */
    Intent classifyAct(String q, String original, ChatHistory history) {
        String[] words = words(q);

        Matcher greeting = GREETING.matcher(q);
        if (greeting.find()) {
            String remainder = q.substring(greeting.end()).trim();
            if (remainder.isEmpty()) return Intent.GREETING;
            if (!QUESTION_WORDS.matcher(remainder).find() && !TOPIC_KEYWORDS.matcher(remainder).find() && words.length <= 4) {
                return Intent.GREETING;
            }
        }

        Matcher followUp = FOLLOW_UP_START.matcher(q);
        if (followUp.find() && words(followUp.group(1)).length >= 2) {
            return Intent.FAQ_QUESTION;
        }

        if (HOW_TO.matcher(q).find()) return Intent.FAQ_QUESTION;

        if (HELP.matcher(q).find() && !TOPIC_KEYWORDS.matcher(q).find() && !FOR_ABOUT_CONTENT.matcher(q).find()) {
            return Intent.HELP;
        }

        if (words.length <= 3 && NEGATIVES.contains(q)) return Intent.NEGATIVE;
        if (words.length <= 2 && AFFIRMATIVES.contains(q)) return Intent.AFFIRMATIVE;

        if (CONFIRMATION.matcher(q).find() && !hasQuestion(q, original)) return Intent.STATEMENT;

        if (TOPIC_KEYWORDS.matcher(q).find()) {
            if (THANKS_LIKE.matcher(q).find() && words.length <= 4 && !hasQuestion(q, original)) return Intent.STATEMENT;
            return Intent.FAQ_QUESTION;
        }

        if (words.length <= 3 && isStatement(q)) return Intent.STATEMENT;
        if (words.length <= 2 && askedAnythingElse(history) && isFuzzyAcknowledgement(q)) return Intent.STATEMENT;

        if (isAskingForInformation(q, original, words)) return Intent.FAQ_QUESTION;

        if (words.length <= 8 && completionClient.isConfigured()) {
            return classifyWithCompletion(original, history).orElse(defaultIntent);
        }
        return defaultIntent;
    }

    /** Narrows an information request to a topic, or asks for clarification when it is too vague to answer. */
    Intent refine(Intent act, String q, ChatHistory history) {
        if (act != Intent.FAQ_QUESTION) return act;
        if ((history == null || history.isEmpty()) && needsClarification(q)) {
            return Intent.CLARIFICATION_NEEDED;
        }
        return topicDetector.detect(q).orElse(Intent.FAQ_QUESTION);
    }

    public String getClarificationQuestion(String query) {
        String q = normalize(query);
        if (VAGUE_PRICE.matcher(q).find()) {
            return "Which cottage (9 or 11), which dates (weekday/weekend), and how many guests?";
        }
        if (VAGUE_FACILITIES.matcher(q).find()) {
            return "Which type of facilities are you interested in? (e.g., kitchen, parking, BBQ, WiFi, etc.)";
        }
        return "Could you please provide more details?";
    }

    /** True when the assistant's last answer asked whether the guest wants anything else. */
    public static boolean askedAnythingElse(ChatHistory history) {
        return history != null && history.lastAnswer()
                .map(answer -> ANYTHING_ELSE.matcher(answer).find())
                .orElse(false);
    }

    boolean needsClarification(String q) {
        int count = words(q).length;
        if (count < 2 || count > 3) return false;
        if (VAGUE_PRICE.matcher(q).find() && !PRICE_CONTEXT.matcher(q).find()) return true;
        return VAGUE_FACILITIES.matcher(q).find() && !FACILITY_CONTEXT.matcher(q).find();
    }

    private boolean isStatement(String q) {
        if (PREPOSITIONS.contains(words(q)[0])) return false;
        for (String statement : STATEMENTS) {
            if (q.equals(statement)) return true;
            if (q.startsWith(statement + " ") && STATEMENT_FILLERS.contains(q.substring(statement.length()).trim())) {
                return true;
            }
        }
        return false;
    }

    private boolean isFuzzyAcknowledgement(String q) {
        if (q.length() < 4) return false;
        for (String ack : ACKNOWLEDGEMENTS) {
            if (StringUtils.getLevenshteinDistance(q, ack, 2) >= 0) return true;
        }
        return false;
    }

    private boolean isAskingForInformation(String q, String original, String[] words) {
        if (hasQuestion(q, original)) return true;
        if (ACTION_VERBS.matcher(q).find()) return true;
        if (FOR_ABOUT_CONTENT.matcher(q).find() || q.matches(".*\\b(?:for|about)\\s+\\w+.*")) return true;
        if (DIGITS.matcher(q).find()) return true;
        if (words.length > 2 && !HELP.matcher(q).find()) return true;
        return words.length >= 2 && words.length <= 3;
    }

    private Optional<Intent> classifyWithCompletion(String query, ChatHistory history) {
        String prompt = """
                You are an intent classifier. Classify the user query into ONE of these categories:
                - greeting: simple greetings like "hi", "hello", "hey"
                - help: asking what the assistant can do, like "how can you help", "what can you do"
                - question: asking FOR information about a topic (booking, pricing, facilities, location, etc.)
                - statement: acknowledgements like "thanks", "ok", "got it", "understood"

                When in doubt, answer question.

                User query: "%s"

                Previous conversation:
                %s

                Respond with ONLY the category name (greeting, help, question, or statement):"""
                .formatted(query, history == null || history.isEmpty() ? "None" : history.render());

        CompletionResult result = completionClient.generate(prompt, classificationMaxTokens);
        if (!result.success()) {
            log.warn("Intent classification fallback failed ({}): {}", result.failure(), result.message());
            return Optional.empty();
        }
        String label = result.textOrEmpty().trim().toLowerCase(Locale.ROOT);
        log.debug("Completion classified '{}' as '{}'", query, label);
        if (label.contains("statement")) return Optional.of(Intent.STATEMENT);
        if (label.startsWith("greet")) return Optional.of(Intent.GREETING);
        if (label.contains("help") && !label.contains("question")) return Optional.of(Intent.HELP);
        if (label.contains("question")) return Optional.of(Intent.FAQ_QUESTION);
        return Optional.empty();
    }

    private static boolean hasQuestion(String q, String original) {
        return QUESTION_WORDS.matcher(q).find() || (original != null && original.contains("?"));
    }

    static String normalize(String query) {
        return query.toLowerCase(Locale.ROOT)
                .replaceAll("[!.,;:]+", " ")
                .replaceAll("\\?+", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String[] words(String q) {
        String trimmed = q.trim();
        if (trimmed.isEmpty()) return new String[0];
        return Arrays.stream(trimmed.split("\\s+")).filter(w -> !w.isEmpty()).toArray(String[]::new);
    }
}
