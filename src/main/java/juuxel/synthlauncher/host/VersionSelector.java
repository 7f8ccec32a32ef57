/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.host;

import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.resolve.VersionResolver;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.Task;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Keeps at most one version resolution active. Selecting a version cancels the previous
 * resolution; that handle still drains to its cancelled result and remains the caller's to await.
 */
public final class VersionSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(VersionSelector.class);

    private final VersionResolver resolver;
    private final LauncherState state;
    private @Nullable Task<ResolvedVersion> active;

    public VersionSelector(VersionResolver resolver, LauncherState state) {
        this.resolver = resolver;
        this.state = state;
    }

    public synchronized Task<ResolvedVersion> select(int index) {
        if (active != null && !active.poll()) {
            LOGGER.debug("Superseding {}", active.name());
            active.cancel();
        }

        active = resolver.resolve(state, index);
        return active;
    }

    /** The resolution started by the latest selection, unless it was cancelled through {@link #cancel()}. */
    public synchronized Optional<Task<ResolvedVersion>> active() {
        return Optional.ofNullable(active);
    }

    public synchronized void cancel() {
        if (active != null) {
            active.cancel();
            active = null;
        }
    }
}
