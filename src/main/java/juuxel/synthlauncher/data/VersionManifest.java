/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * The global list of game versions ({@code version_manifest.json}).
 */
public record VersionManifest(Latest latest, List<Version> versions) {
    public VersionManifest validate() {
        Required.member(latest, "latest", "the version manifest");
        for (Version version : Required.member(versions, "versions", "the version manifest")) {
            var id = Required.member(version.id(), "id", "a version entry");
            Required.member(version.type(), "type", id);
            Required.member(version.url(), "url", id);
        }
        return this;
    }

    public Optional<Version> find(String id) {
        return versions.stream().filter(version -> version.id().equals(id)).findFirst();
    }

    public Optional<Version> latestRelease() {
        return find(latest.release());
    }

    public Optional<Version> latestSnapshot() {
        return find(latest.snapshot());
    }

    public record Latest(String release, String snapshot) {
    }

    public record Version(String id, ReleaseKind type, String url, @Nullable String sha1, @Nullable String releaseTime) {
    }
}
