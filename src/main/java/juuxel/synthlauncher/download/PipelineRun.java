/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Pollable;
import juuxel.synthlauncher.task.Progress;
import juuxel.synthlauncher.task.Task;

/**
 * A started pipeline: its task handle and the progress counter its worker writes.
 */
public record PipelineRun<T>(String name, Task<T> task, Progress progress) implements Pollable<T> {
    @Override
    public boolean poll() {
        return task.poll();
    }

    @Override
    public void cancel() {
        task.cancel();
    }

    @Override
    public T await() throws LauncherException {
        return task.await();
    }
}
