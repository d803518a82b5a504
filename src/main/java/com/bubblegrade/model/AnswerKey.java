package com.bubblegrade.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Ordered list of correct choice letters for one exam, question one first.
 */
public record AnswerKey(List<String> correctChoices) {

    public AnswerKey {
        if (correctChoices == null || correctChoices.isEmpty()) {
            throw new IllegalArgumentException("Answer key must contain at least one answer");
        }
        List<String> normalized = new ArrayList<>(correctChoices.size());
        for (String choice : correctChoices) {
            if (choice == null || !choice.trim().matches("[A-Za-z]")) {
                throw new IllegalArgumentException("Answer key entries must be single letters but found: " + choice);
            }
            normalized.add(choice.trim().toUpperCase(Locale.ROOT));
        }
        correctChoices = List.copyOf(normalized);
    }

    /**
     * Parses a comma separated list of letters such as {@code "A,B,C,D"}.
     */
    public static AnswerKey parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            throw new IllegalArgumentException("Answer key must not be blank");
        }
        return new AnswerKey(Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .toList());
    }

    public int size() {
        return correctChoices.size();
    }

    public String correctChoice(int question) {
        return correctChoices.get(question);
    }

    public boolean isCorrect(int question, String marked) {
        return question < correctChoices.size()
                && marked != null
                && correctChoices.get(question).equals(marked);
    }
}
