package com.pushit.service.verification;

import java.util.ArrayList;
import java.util.List;

/** Counts passed checks and collects flags while a verifier runs. */
final class CheckTally {

    private int passed;
    private int total;
    private final List<String> flags = new ArrayList<>();

    /** Counts one check; adds {@code flagIfFailed} when it did not pass. */
    boolean check(boolean ok, String flagIfFailed) {
        total++;
        if (ok) {
            passed++;
        } else if (flagIfFailed != null) {
            flags.add(flagIfFailed);
        }
        return ok;
    }

    int passed() {
        return passed;
    }

    int total() {
        return total;
    }

    List<String> flags() {
        return flags;
    }

    double confidence() {
        return total > 0 ? (double) passed / total : 0.0;
    }

    String summary() {
        return String.format("Passed %d/%d checks", passed, total);
    }
}
