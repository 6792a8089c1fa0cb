package com.ai.concierge.conversation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded question/answer history for one session; the oldest turn drops first.
 */
public class ChatHistory {

    private final int maxTurns;
    private final Deque<Turn> turns = new ArrayDeque<>();

    public ChatHistory(int maxTurns) {
        this.maxTurns = Math.max(1, maxTurns);
    }

    public void append(String question, String answer) {
        turns.addLast(new Turn(question, answer));
        while (turns.size() > maxTurns) turns.removeFirst();
    }

    public List<Turn> turns() {
        return new ArrayList<>(turns);
    }

    public Optional<Turn> last() {
        return Optional.ofNullable(turns.peekLast());
    }

    public Optional<String> lastAnswer() {
        return last().map(Turn::answer);
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public void clear() {
        turns.clear();
    }

    /** History rendered for prompts, one "question: ..., answer: ..." line per turn. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("question: ").append(turn.question()).append(", answer: ").append(turn.answer());
        }
        return sb.toString();
    }

    public record Turn(String question, String answer) {
    }
}
