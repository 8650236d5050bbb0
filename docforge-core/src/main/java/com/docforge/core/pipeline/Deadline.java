package com.docforge.core.pipeline;

import java.time.Duration;

/**
 * Wall-clock deadline of one build.
 */
final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    boolean expired() {
        return remaining().isZero();
    }

    /**
     * Returns the time a single call may take: its own timeout, capped by what is left.
     */
    Duration budgetFor(Duration callTimeout) {
        Duration left = remaining();
        return left.compareTo(callTimeout) < 0 ? left : callTimeout;
    }
}
