/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.resolve;

import juuxel.synthlauncher.Download;
import juuxel.synthlauncher.FileUtil;
import juuxel.synthlauncher.Futures;
import juuxel.synthlauncher.data.VersionManifest;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Task;
import juuxel.synthlauncher.task.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Fetches the version manifest into the launcher state. Each run replaces the previous
 * manifest wholesale; a failed run leaves the state as it was.
 */
public final class ManifestResolver {
    public static final String CACHE_FILE = "version_manifest.json";
    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestResolver.class);

    private final TaskRunner runner;

    public ManifestResolver(TaskRunner runner) {
        this.runner = runner;
    }

    public Task<VersionManifest> resolveManifest(LauncherState state) {
        return runner.start("Resolving the version manifest", token -> fetch(state, token));
    }

    public static VersionManifest fetch(LauncherState state, CancellationToken token) throws LauncherException {
        var config = state.config();
        var url = config.endpoints().versionManifest();
        byte[] body = Download.await(Futures.retrying(config.retries(), url, () -> Download.bytes(url)), token, url);
        var manifest = Download.parse(body, VersionManifest.class).validate();

        FileUtil.writeAtomically(cacheFile(state), body);
        token.throwIfCancelled("Resolving the version manifest");
        state.setManifest(manifest);
        LOGGER.info("Resolved {} versions, latest release is {}", manifest.versions().size(), manifest.latest().release());
        return manifest;
    }

    public static Path cacheFile(LauncherState state) {
        return state.config().versionsDirectory().resolve(CACHE_FILE);
    }
}
