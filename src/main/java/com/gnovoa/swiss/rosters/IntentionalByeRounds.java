package com.gnovoa.swiss.rosters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Set;
import java.util.TreeSet;

/**
 * Normalises the loosely typed {@code intentional_bye_rounds} column.
 *
 * <p>Accepted shapes: {@code [1, 3]}, {@code 2}, {@code "[1,3]"}, {@code "1, 3"},
 * {@code "2"}, null or empty.
 */
public final class IntentionalByeRounds {

    private final ObjectMapper mapper;

    public IntentionalByeRounds(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException for anything that is not a list of positive rounds
     */
    public Set<Integer> normalize(JsonNode raw) {
        Set<Integer> rounds = new TreeSet<>();
        collect(raw, rounds);
        return rounds;
    }

    public Set<Integer> normalize(String raw) {
        Set<Integer> rounds = new TreeSet<>();
        if (raw != null) collectText(raw, rounds);
        return rounds;
    }

    private void collect(JsonNode node, Set<Integer> rounds) {
        if (node == null || node.isNull() || node.isMissingNode()) return;
        if (node.isArray()) {
            for (JsonNode element : node) collect(element, rounds);
        } else if (node.isIntegralNumber()) {
            rounds.add(checked(node.asInt()));
        } else if (node.isTextual()) {
            collectText(node.asText(), rounds);
        } else {
            throw new IllegalArgumentException("Unsupported intentional bye rounds value " + node);
        }
    }

    private void collectText(String text, Set<Integer> rounds) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return;
        if (trimmed.startsWith("[")) {
            try {
                collect(mapper.readTree(trimmed), rounds);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid intentional bye rounds JSON " + trimmed, e);
            }
            return;
        }
        for (String part : trimmed.split(",")) {
            String round = part.trim();
            if (round.isEmpty()) continue;
            try {
                rounds.add(checked(Integer.parseInt(round)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid intentional bye round '" + round + "'", e);
            }
        }
    }

    private static int checked(int round) {
        if (round < 1) throw new IllegalArgumentException("Bye round must be positive, got " + round);
        return round;
    }
}
