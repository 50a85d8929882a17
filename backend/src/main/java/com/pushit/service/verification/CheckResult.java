package com.pushit.service.verification;

import java.util.List;

/** Outcome of one independent rule check. */
public record CheckResult(boolean valid, double score, List<String> flags) {

    public CheckResult {
        flags = List.copyOf(flags);
    }

    public static CheckResult of(boolean valid, double score, String... flags) {
        return new CheckResult(valid, score, List.of(flags));
    }
}
