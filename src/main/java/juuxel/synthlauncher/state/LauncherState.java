/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.auth.AuthSession;
import juuxel.synthlauncher.data.AssetIndex;
import juuxel.synthlauncher.data.LauncherData;
import juuxel.synthlauncher.data.ReleaseKind;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.data.VersionManifest;
import juuxel.synthlauncher.data.VersionMetadata;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.LauncherException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one launcher session works against: the configuration, the resolved manifest
 * and version, the pending device-code session and the persisted registries.
 *
 * <p>Tasks receive the state by reference and outlive none of it. The resolved pieces are
 * replaced wholesale, never patched.
 */
public final class LauncherState {
    private static final Logger LOGGER = LoggerFactory.getLogger(LauncherState.class);

    private final LauncherConfig config;
    private final LauncherStorage storage;
    private final AccountRegistry accounts;
    private final JvmRegistry jvms;

    private volatile @Nullable VersionManifest manifest;
    private @Nullable VersionMetadata version;
    private @Nullable AssetIndex assetIndex;
    private @Nullable AuthSession authSession;

    private LauncherState(LauncherConfig config, LauncherStorage storage, LauncherData data) {
        this.config = config;
        this.storage = storage;
        this.accounts = new AccountRegistry(data.accounts());
        this.jvms = new JvmRegistry(data.jvms());
    }

    public static LauncherState load(LauncherConfig config, LauncherStorage storage) throws LauncherException {
        var data = storage.read();
        LOGGER.debug("Loaded {} accounts and {} JVMs", data.accounts().size(), data.jvms().size());
        return new LauncherState(config, storage, data);
    }

    public LauncherConfig config() {
        return config;
    }

    public AccountRegistry accounts() {
        return accounts;
    }

    public JvmRegistry jvms() {
        return jvms;
    }

    public void commit() throws LauncherException {
        storage.commit(new LauncherData(jvms.persisted(), accounts.toList()));
    }

    // Manifest

    public boolean hasManifest() {
        return manifest != null;
    }

    public VersionManifest manifest() throws LauncherException {
        var current = manifest;
        if (current == null) throw LauncherException.precondition("The version manifest has not been resolved");
        return current;
    }

    public void setManifest(VersionManifest manifest) {
        this.manifest = manifest;
    }

    public int manifestLength() throws LauncherException {
        return manifest().versions().size();
    }

    public VersionManifest.Version version(int index) throws LauncherException {
        var versions = manifest().versions();
        if (index < 0 || index >= versions.size()) {
            throw LauncherException.precondition("No version at index " + index + " (" + versions.size() + " known)");
        }
        return versions.get(index);
    }

    public String versionName(int index) throws LauncherException {
        return version(index).id();
    }

    public ReleaseKind versionKind(int index) throws LauncherException {
        return version(index).type();
    }

    /**
     * Finds a version by id. {@code latest} and {@code latest-snapshot} name the manifest's latest versions.
     */
    public int versionIndex(String id) throws LauncherException {
        var current = manifest();
        var target = switch (id) {
            case "latest" -> current.latest().release();
            case "latest-snapshot" -> current.latest().snapshot();
            default -> id;
        };

        var versions = current.versions();
        for (int i = 0; i < versions.size(); i++) {
            if (versions.get(i).id().equals(target)) return i;
        }

        throw LauncherException.precondition("Unknown version: " + id);
    }

    // Selected version

    public synchronized VersionMetadata versionMetadata() throws LauncherException {
        if (version == null) throw LauncherException.precondition("No version has been resolved");
        return version;
    }

    /**
     * Selects a version, dropping the asset index of the previous one.
     * Fails instead if the resolution that produced it was cancelled meanwhile.
     */
    public synchronized void setVersionMetadata(VersionMetadata metadata, CancellationToken token) throws LauncherException {
        token.throwIfCancelled("Resolving " + metadata.id());
        this.version = metadata;
        this.assetIndex = null;
    }

    public synchronized void setAssetIndex(VersionMetadata owner, AssetIndex assetIndex, CancellationToken token) throws LauncherException {
        token.throwIfCancelled("Resolving the asset index of " + owner.id());
        if (version != owner) {
            throw LauncherException.precondition("Asset index for " + owner.id() + " does not belong to the selected version");
        }
        this.assetIndex = assetIndex;
    }

    public synchronized void setResolved(ResolvedVersion resolved, CancellationToken token) throws LauncherException {
        // checked under the lock so a superseded resolution cannot overwrite its successor
        token.throwIfCancelled("Resolving " + resolved.id());
        this.version = resolved.metadata();
        this.assetIndex = resolved.assetIndex();
    }

    public synchronized ResolvedVersion resolved() throws LauncherException {
        if (version == null || assetIndex == null) {
            throw LauncherException.precondition("The selected version has not been fully resolved");
        }
        return new ResolvedVersion(version, assetIndex);
    }

    // Device-code session

    public synchronized void setAuthSession(AuthSession session) {
        if (authSession != null) LOGGER.debug("Replacing pending device code {}", authSession.userCode());
        this.authSession = session;
    }

    public synchronized @Nullable AuthSession authSession() {
        return authSession;
    }

    /** Removes the pending session so that exactly one polling loop consumes it. */
    public synchronized AuthSession takeAuthSession() throws LauncherException {
        var session = authSession;
        if (session == null) throw LauncherException.precondition("No device code has been requested");
        authSession = null;
        return session;
    }
}
