/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts {@link Task}s. Every task gets its own worker thread; there is no shared
 * queue and no ordering between unrelated tasks.
 */
public final class TaskRunner implements AutoCloseable {
    private final ExecutorService executor = Executors.newCachedThreadPool(new WorkerFactory());

    public <T> Task<T> start(String name, Work<T> work) {
        return start(name, CancellationToken.create(), work);
    }

    /**
     * Starts a task whose cancellation is tied to an existing token, for example
     * to let a parent operation cancel several tasks at once.
     */
    public <T> Task<T> start(String name, CancellationToken token, Work<T> work) {
        var task = new Task<T>(name, token);
        executor.execute(() -> task.run(work));
        return task;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            var thread = new Thread(runnable, "synth-task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
