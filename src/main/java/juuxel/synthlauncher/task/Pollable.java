/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

/**
 * Something a host loop can drive: polled until terminal, then awaited once.
 *
 * @param <T> the produced value
 * @see Task
 */
public interface Pollable<T> {
    String name();

    /** Returns {@code true} once terminal, and keeps returning it. Never blocks. */
    boolean poll();

    T await() throws LauncherException;

    void cancel();
}
