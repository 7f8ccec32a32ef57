/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@code (total, finished)} pair written by one worker and read by a poller without locking.
 *
 * <p>{@code total} is published once through {@link #begin(long)} before any
 * {@link #advance(long)}, and {@code finished} is clamped to it, so every
 * {@link #snapshot()} satisfies {@code finished <= total}.
 */
public final class Progress {
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong finished = new AtomicLong();
    private volatile boolean begun;

    /**
     * Publishes the amount of work. May only be called once.
     */
    public void begin(long total) {
        if (total < 0) throw new IllegalArgumentException("Negative total: " + total);
        if (begun) throw new IllegalStateException("Progress already begun");
        this.total.set(total);
        begun = true;
    }

    public void advance(long amount) {
        long limit = total.get();
        finished.accumulateAndGet(amount, (current, added) -> Math.min(current + added, limit));
    }

    public Snapshot snapshot() {
        // reverse of the write order in begin and advance, so a begun snapshot sees its total
        // and finished never overtakes it
        boolean known = begun;
        long done = finished.get();
        long all = total.get();
        return new Snapshot(all, done, known);
    }

    /**
     * @param total    the amount of work, 0 while unknown
     * @param finished the work done so far
     * @param begun    whether the total has been published (distinguishes "zero work" from "unknown")
     */
    public record Snapshot(long total, long finished, boolean begun) {
        public boolean isKnown() {
            return total != 0;
        }

        public OptionalDouble fraction() {
            return total == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) finished / total);
        }

        @Override
        public String toString() {
            if (total == 0) return begun ? "0/0" : "starting";
            return String.format(Locale.ROOT, "%d/%d (%.1f%%)", finished, total, 100.0 * finished / total);
        }
    }
}
