/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.host;

import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.TaskRunner;
import juuxel.synthlauncher.task.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static juuxel.synthlauncher.TestFixtures.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

class TaskDispatcherTest {
    private final TaskRunner runner = new TaskRunner();
    private final TaskDispatcher dispatcher = new TaskDispatcher(Duration.ofMillis(5));

    @AfterEach
    void tearDown() {
        dispatcher.close();
        runner.close();
    }

    @Test
    void watch_shouldCompleteWithTheValue() throws Exception {
        var task = runner.start("answer", token -> 42);

        assertEquals(42, dispatcher.watch(task).get(10, TimeUnit.SECONDS));
        assertEquals(TaskState.CONSUMED, task.state());
    }

    @Test
    void watch_shouldCompleteExceptionallyWithTheFailure() {
        var task = runner.start("failing", token -> {
            throw new LauncherException(ErrorKind.NETWORK, "offline");
        });

        var e = assertThrows(ExecutionException.class, () -> dispatcher.watch(task).get(10, TimeUnit.SECONDS));
        var cause = assertInstanceOf(LauncherException.class, e.getCause());
        assertEquals(ErrorKind.NETWORK, cause.kind());
    }

    @Test
    void watch_shouldNotBlockWhileTasksRun() throws Exception {
        var release = new CountDownLatch(1);
        var slow = dispatcher.watch(runner.start("slow", token -> release.await(10, TimeUnit.SECONDS)));
        var fast = dispatcher.watch(runner.start("fast", token -> "done"));

        assertEquals("done", fast.get(10, TimeUnit.SECONDS));
        assertFalse(slow.isDone());
        assertEquals(1, dispatcher.pending());

        release.countDown();
        assertTrue(slow.get(10, TimeUnit.SECONDS));
    }

    @Test
    void cancellingTheFuture_shouldCancelTheTask() {
        var task = runner.start("endless", token -> {
            token.sleep(Duration.ofMinutes(1), "endless");
            return "never";
        });

        dispatcher.watch(task).cancel(false);

        waitUntil(task::poll, "the task to stop");
        waitUntil(() -> dispatcher.pending() == 0, "the dispatcher to drop the task");
        assertEquals(TaskState.CONSUMED, task.state());
    }

    @Test
    void onTick_shouldKeepRunningAfterAListenerFails() {
        var ticks = new AtomicInteger();
        dispatcher.onTick(() -> {
            throw new IllegalStateException("broken listener");
        });
        dispatcher.onTick(ticks::incrementAndGet);

        waitUntil(() -> ticks.get() >= 3, "three ticks");
    }

    @Test
    void close_shouldCancelWatchedTasks() {
        var task = runner.start("endless", token -> {
            token.sleep(Duration.ofMinutes(1), "endless");
            return "never";
        });
        dispatcher.watch(task);

        dispatcher.close();
        waitUntil(task::poll, "the task to stop");

        var e = assertThrows(LauncherException.class, task::await);
        assertEquals(ErrorKind.CANCELLED, e.kind());
    }
}
