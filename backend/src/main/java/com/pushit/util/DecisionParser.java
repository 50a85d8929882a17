package com.pushit.util;

import java.util.Locale;
import java.util.Set;

/** Parses free-text admin decisions into enum constants. */
public final class DecisionParser {

    private DecisionParser() {}

    /**
     * @throws IllegalArgumentException when the value does not name one of {@code allowed}
     */
    public static <E extends Enum<E>> E parse(Class<E> type, String value, Set<E> allowed) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision is required");
        }
        E decision;
        try {
            decision = Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown decision: " + value, e);
        }
        if (!allowed.contains(decision)) {
            throw new IllegalArgumentException("Decision must be one of " + allowed);
        }
        return decision;
    }
}
