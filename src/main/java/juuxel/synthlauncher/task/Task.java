/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cancellable, pollable handle to one unit of background work.
 *
 * <p>The handle is owned by whoever started it. {@link #poll()} never blocks and can be
 * called as often as the host likes; once it returns {@code true} it keeps returning
 * {@code true}. {@link #await()} consumes the result exactly once.
 *
 * <p>{@link #cancel()} is cooperative: it flags the token and interrupts the worker, but
 * the handle still has to be polled until terminal and then awaited to observe the
 * {@link ErrorKind#CANCELLED} outcome. A task cancelled before it reached its terminal
 * state never yields a value, even if the work happened to finish anyway.
 *
 * @param <T> the produced value
 */
public final class Task<T> implements Pollable<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Task.class);

    private final String name;
    private final CancellationToken token;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean consumed = new AtomicBoolean();
    private @Nullable Thread worker;

    Task(String name, CancellationToken token) {
        this.name = name;
        this.token = token;
    }

    void run(Work<T> work) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Task '" + name + "' was already started");
        }

        synchronized (this) {
            worker = Thread.currentThread();
        }

        try {
            if (token.isCancelled()) {
                future.completeExceptionally(LauncherException.cancelled(name));
            } else {
                future.complete(work.run(token));
            }
        } catch (Throwable t) {
            future.completeExceptionally(t);
        } finally {
            synchronized (this) {
                worker = null;
            }

            // Pooled threads must not carry a pending interrupt into the next task
            Thread.interrupted();
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean poll() {
        return future.isDone();
    }

    public TaskState state() {
        if (consumed.get()) return TaskState.CONSUMED;
        if (future.isDone()) return TaskState.READY;
        if (token.isCancelled()) return TaskState.CANCELLED;
        return started.get() ? TaskState.POLLING : TaskState.CREATED;
    }

    @Override
    public void cancel() {
        if (future.isDone()) return;

        LOGGER.debug("Cancelling {}", name);
        token.cancel();

        synchronized (this) {
            if (worker != null) worker.interrupt();
        }
    }

    /**
     * Blocks until the task is terminal and returns its value.
     *
     * @throws LauncherException     if the work failed or was cancelled
     * @throws IllegalStateException if the result was already consumed
     */
    @Override
    public T await() throws LauncherException {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Task '" + name + "' was already awaited");
        }

        try {
            T value = future.join();
            if (token.isCancelled()) throw LauncherException.cancelled(name);
            return value;
        } catch (CompletionException e) {
            if (token.isCancelled()) {
                throw new LauncherException(ErrorKind.CANCELLED, name + " was cancelled", e.getCause());
            }

            throw LauncherException.of(e.getCause(), name);
        }
    }
}
