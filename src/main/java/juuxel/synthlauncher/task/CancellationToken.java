/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A cooperative cancellation flag. Work checks it at its own granularity
 * (between files, chunks or protocol round-trips).
 *
 * <p>Cancelling a token cancels all of its {@linkplain #child() children};
 * cancelling a child leaves the parent untouched.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        var child = new CancellationToken();
        children.add(child);
        // cancel() may have run before the child was registered
        if (isCancelled()) child.cancel();
        return child;
    }

    public void cancel() {
        if (cancelled.getCount() == 0) return;
        cancelled.countDown();
        children.forEach(CancellationToken::cancel);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled(String what) throws LauncherException {
        if (isCancelled()) throw LauncherException.cancelled(what);
    }

    /**
     * Sleeps for the given duration, waking up early if the token is cancelled.
     *
     * @throws LauncherException with kind {@link ErrorKind#CANCELLED} if the token
     *                           was cancelled before or during the sleep
     */
    public void sleep(Duration duration, String what) throws LauncherException {
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw LauncherException.cancelled(what);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LauncherException(ErrorKind.CANCELLED, what + " was interrupted", e);
        }
    }
}
