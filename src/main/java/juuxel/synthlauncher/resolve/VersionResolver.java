/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.resolve;

import com.squareup.moshi.JsonDataException;
import juuxel.synthlauncher.Download;
import juuxel.synthlauncher.FileUtil;
import juuxel.synthlauncher.Futures;
import juuxel.synthlauncher.data.AssetIndex;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.data.VersionManifest;
import juuxel.synthlauncher.data.VersionMetadata;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Task;
import juuxel.synthlauncher.task.TaskRunner;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

/**
 * Resolves a selected version in two dependent stages: its metadata, then the asset index the
 * metadata points at.
 *
 * <p>The chained {@link #resolve} threads one cancellation token through both stages and checks
 * it in between, so a resolution cancelled after the first stage never starts the second.
 * Keeping at most one resolution active is up to the caller; see
 * {@link juuxel.synthlauncher.host.VersionSelector}.
 */
public final class VersionResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(VersionResolver.class);

    private final TaskRunner runner;

    public VersionResolver(TaskRunner runner) {
        this.runner = runner;
    }

    /** Stage one on its own: fetches the metadata of the version at {@code index} and selects it. */
    public Task<VersionMetadata> resolveVersion(LauncherState state, int index) {
        return runner.start("Resolving version #" + index, token -> {
            var metadata = fetchVersion(state, state.version(index), token);
            state.setVersionMetadata(metadata, token);
            return metadata;
        });
    }

    /** Stage two on its own: fetches the asset index of the currently selected version. */
    public Task<AssetIndex> resolveAssetIndex(LauncherState state) {
        return runner.start("Resolving the asset index", token -> {
            var metadata = state.versionMetadata();
            var assetIndex = fetchAssetIndex(state, metadata, token);
            state.setAssetIndex(metadata, assetIndex, token);
            return assetIndex;
        });
    }

    public Task<ResolvedVersion> resolve(LauncherState state, int index) {
        return resolve(state, index, CancellationToken.create());
    }

    public Task<ResolvedVersion> resolve(LauncherState state, int index, CancellationToken token) {
        return runner.start("Resolving version #" + index, token, t -> {
            var version = state.version(index);
            var metadata = fetchVersion(state, version, t);
            t.throwIfCancelled("Resolving " + version.id());

            var assetIndex = fetchAssetIndex(state, metadata, t);
            var resolved = new ResolvedVersion(metadata, assetIndex);
            state.setResolved(resolved, t);
            LOGGER.info("Resolved {} with {} assets and {} libraries",
                version.id(), assetIndex.objects().size(), metadata.libraries().size());
            return resolved;
        });
    }

    public static VersionMetadata fetchVersion(LauncherState state, VersionManifest.Version version, CancellationToken token) throws LauncherException {
        Path cache = state.config().versionsDirectory().resolve(version.id()).resolve(version.id() + ".json");
        boolean cached = version.sha1() != null ? FileUtil.isValid(cache, version.sha1()) : Files.isRegularFile(cache);

        if (cached) {
            try {
                LOGGER.debug("Using cached metadata for {}", version.id());
                return Download.parse(Files.readAllBytes(cache), VersionMetadata.class).validate();
            } catch (IOException | JsonDataException e) {
                LOGGER.warn("Ignoring unreadable cached metadata {}: {}", cache, e.getMessage());
            }
        }

        byte[] body = fetchVerified(state, version.url(), version.sha1(), token);
        var metadata = Download.parse(body, VersionMetadata.class).validate();
        FileUtil.writeAtomically(cache, body);
        return metadata;
    }

    public static AssetIndex fetchAssetIndex(LauncherState state, VersionMetadata metadata, CancellationToken token) throws LauncherException {
        var reference = metadata.assetIndex();
        Path cache = state.config().assetsDirectory().resolve("indexes").resolve(reference.id() + ".json");

        byte[] body;
        try {
            if (FileUtil.isValid(cache, reference.sha1())) {
                LOGGER.debug("Using cached asset index {}", reference.id());
                body = Files.readAllBytes(cache);
            } else {
                body = fetchVerified(state, reference.url(), reference.sha1(), token);
                FileUtil.writeAtomically(cache, body);
            }
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not read " + cache, e);
        }

        return Download.parse(body, AssetIndex.class).validate();
    }

    private static byte[] fetchVerified(LauncherState state, String url, @Nullable String sha1, CancellationToken token) throws LauncherException {
        var future = Futures.retrying(state.config().retries(), url, () -> Download.bytes(url).thenApply(body -> {
            if (sha1 != null && !FileUtil.sha1(body).equalsIgnoreCase(sha1)) {
                throw new CompletionException(new LauncherException(ErrorKind.IO, "Hash mismatch for " + url + ", expected " + sha1));
            }
            return body;
        }));
        return Download.await(future, token, url);
    }
}
