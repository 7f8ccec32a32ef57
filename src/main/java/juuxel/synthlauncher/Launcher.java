/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import juuxel.synthlauncher.auth.AuthFlow;
import juuxel.synthlauncher.auth.AuthSession;
import juuxel.synthlauncher.auth.IdentityProvider;
import juuxel.synthlauncher.auth.MicrosoftIdentityProvider;
import juuxel.synthlauncher.data.Account;
import juuxel.synthlauncher.data.AssetIndex;
import juuxel.synthlauncher.data.Jvm;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.data.VersionManifest;
import juuxel.synthlauncher.data.VersionMetadata;
import juuxel.synthlauncher.download.DownloadSet;
import juuxel.synthlauncher.host.VersionSelector;
import juuxel.synthlauncher.resolve.ManifestResolver;
import juuxel.synthlauncher.resolve.VersionResolver;
import juuxel.synthlauncher.state.JsonFileStorage;
import juuxel.synthlauncher.state.JvmProbe;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.state.LauncherStorage;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Task;
import juuxel.synthlauncher.task.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One launcher session: the state plus every operation that can be started against it.
 * Long-running operations return task handles; registry edits are immediate and saved right away.
 */
public final class Launcher implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Launcher.class);

    private final LauncherState state;
    private final TaskRunner runner = new TaskRunner();
    private final ManifestResolver manifestResolver = new ManifestResolver(runner);
    private final VersionResolver versionResolver = new VersionResolver(runner);
    private final VersionSelector versionSelector;
    private final AuthFlow authFlow;

    private Launcher(LauncherState state, IdentityProvider identityProvider) {
        this.state = state;
        this.versionSelector = new VersionSelector(versionResolver, state);
        this.authFlow = new AuthFlow(runner, identityProvider);
    }

    public static Launcher open(LauncherConfig config) throws LauncherException {
        return open(config, JsonFileStorage.in(config.dataDirectory()), new MicrosoftIdentityProvider(config));
    }

    public static Launcher open(LauncherConfig config, LauncherStorage storage, IdentityProvider identityProvider) throws LauncherException {
        return new Launcher(LauncherState.load(config, storage), identityProvider);
    }

    public LauncherState state() {
        return state;
    }

    public LauncherConfig config() {
        return state.config();
    }

    public Task<VersionManifest> resolveManifest() {
        return manifestResolver.resolveManifest(state);
    }

    public Task<VersionMetadata> resolveVersion(int index) {
        return versionResolver.resolveVersion(state, index);
    }

    public Task<AssetIndex> resolveAssetIndex() {
        return versionResolver.resolveAssetIndex(state);
    }

    public Task<ResolvedVersion> selectVersion(int index) {
        return versionSelector.select(index);
    }

    public DownloadSet startDownloads() throws LauncherException {
        return DownloadSet.start(runner, state);
    }

    public Task<AuthSession> requestDeviceCode() {
        return authFlow.requestDeviceCode(state);
    }

    public Task<Account> pollDeviceAuthorization() {
        return authFlow.pollDeviceAuthorization(state);
    }

    public Task<Account> refreshAccount(int index) {
        return authFlow.refreshAccount(state, index);
    }

    public Account removeAccount(int index) throws LauncherException {
        var removed = state.accounts().remove(index);
        state.commit();
        LOGGER.info("Removed account {}", removed.displayName());
        return removed;
    }

    public Task<Jvm> addJvm(String path) {
        return runner.start("Probing " + path, token -> {
            var jvm = JvmProbe.probe(path, token);
            token.throwIfCancelled("Probing " + path);
            state.jvms().add(jvm);
            state.commit();
            LOGGER.info("Registered {} at {}", jvm.name(), jvm.path());
            return jvm;
        });
    }

    public Jvm removeJvm(int index) throws LauncherException {
        var removed = state.jvms().remove(index);
        state.commit();
        return removed;
    }

    @Override
    public void close() {
        runner.close();
    }
}
