/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTest {
    @Test
    void snapshot_shouldBeUnknownBeforeBegin() {
        var snapshot = new Progress().snapshot();

        assertFalse(snapshot.isKnown());
        assertFalse(snapshot.begun());
        assertTrue(snapshot.fraction().isEmpty());
        assertEquals("starting", snapshot.toString());
    }

    @Test
    void snapshot_shouldDistinguishZeroWorkFromUnknown() {
        var progress = new Progress();
        progress.begin(0);

        var snapshot = progress.snapshot();
        assertTrue(snapshot.begun());
        assertFalse(snapshot.isKnown());
        assertEquals("0/0", snapshot.toString());
    }

    @Test
    void advance_shouldClampToTotal() {
        var progress = new Progress();
        progress.begin(4);
        progress.advance(3);
        progress.advance(3);

        var snapshot = progress.snapshot();
        assertEquals(4, snapshot.finished());
        assertEquals(1.0, snapshot.fraction().orElseThrow());
    }

    @Test
    void toString_shouldShowPercentage() {
        var progress = new Progress();
        progress.begin(4);
        progress.advance(1);

        assertEquals("1/4 (25.0%)", progress.snapshot().toString());
    }

    @Test
    void begin_shouldOnlyBeCalledOnce() {
        var progress = new Progress();
        progress.begin(10);

        assertThrows(IllegalStateException.class, () -> progress.begin(10));
    }

    @Test
    void begin_shouldRejectNegativeTotals() {
        assertThrows(IllegalArgumentException.class, () -> new Progress().begin(-1));
    }

    @Test
    void snapshot_shouldNeverShowMoreFinishedThanTotalWhileWritten() throws InterruptedException {
        var progress = new Progress();
        var done = new AtomicBoolean();
        var violation = new AtomicReference<Progress.Snapshot>();

        var reader = new Thread(() -> {
            while (!done.get()) {
                var snapshot = progress.snapshot();
                if (snapshot.total() != 0 && snapshot.finished() > snapshot.total()) {
                    violation.set(snapshot);
                }
                if (snapshot.total() == 0 && snapshot.finished() != 0) {
                    violation.set(snapshot);
                }
            }
        });
        reader.start();

        progress.begin(200_000);
        for (int i = 0; i < 200_000; i++) {
            progress.advance(1);
        }
        // overshoot must be clamped too
        progress.advance(1_000);

        done.set(true);
        reader.join();

        assertNull(violation.get());
        assertEquals(200_000, progress.snapshot().finished());
    }

    @Test
    void snapshot_shouldSeeTheTotalOnceBegun() throws InterruptedException {
        for (int round = 0; round < 500; round++) {
            var progress = new Progress();
            var writer = new Thread(() -> progress.begin(7));
            writer.start();

            Progress.Snapshot snapshot;
            do {
                snapshot = progress.snapshot();
                assertTrue(!snapshot.begun() || snapshot.total() == 7, "begun without its total: " + snapshot);
            } while (!snapshot.begun());

            writer.join();
        }
    }
}
