package com.pushit.service.queue;

/** Counts from one drain pass over the verification queue. */
public record DrainStats(int processed, int approved, int pending, int skipped, int failed) {

    public static DrainStats empty() {
        return new DrainStats(0, 0, 0, 0, 0);
    }
}
