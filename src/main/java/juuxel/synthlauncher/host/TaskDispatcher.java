/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.host;

import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Pollable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives task handles from one scheduler thread. Every tick polls each watched handle, awaits
 * the ones that are terminal and completes their futures, then runs the tick listeners so a
 * host can redraw progress.
 *
 * <p>Nothing here blocks the caller: {@link #watch(Pollable)} returns immediately, and
 * {@code await} is only ever called on a handle that already polled {@code true}.
 */
public final class TaskDispatcher implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        var thread = new Thread(runnable, "synth-dispatcher");
        thread.setDaemon(true);
        return thread;
    });
    private final Queue<Watched<?>> watched = new ConcurrentLinkedQueue<>();
    private final List<Runnable> tickListeners = new CopyOnWriteArrayList<>();

    public TaskDispatcher(Duration tick) {
        scheduler.scheduleWithFixedDelay(this::tick, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Hands the task to the dispatcher, which becomes the one to await it.
     * The future fails with the task's {@link LauncherException}; cancelling the future cancels the task.
     */
    public <T> CompletableFuture<T> watch(Pollable<T> task) {
        var entry = new Watched<>(task, new CompletableFuture<>());
        entry.future().whenComplete((value, throwable) -> {
            if (entry.future().isCancelled()) task.cancel();
        });
        watched.add(entry);
        return entry.future();
    }

    public void onTick(Runnable listener) {
        tickListeners.add(listener);
    }

    public int pending() {
        return watched.size();
    }

    private void tick() {
        for (Watched<?> entry : watched) {
            if (entry.task().poll()) {
                watched.remove(entry);
                entry.complete();
            }
        }

        for (Runnable listener : tickListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOGGER.error("Tick listener failed", e);
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        watched.forEach(entry -> entry.task().cancel());
    }

    private record Watched<T>(Pollable<T> task, CompletableFuture<T> future) {
        void complete() {
            try {
                future.complete(task.await());
            } catch (LauncherException e) {
                if (e.isCancelled()) {
                    LOGGER.debug("{} was cancelled", task.name());
                }
                future.completeExceptionally(e);
            } catch (RuntimeException | Error e) {
                LOGGER.error("{} failed unexpectedly", task.name(), e);
                future.completeExceptionally(e);
            }
        }
    }
}
