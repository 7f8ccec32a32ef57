/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The metadata of a single game version ({@code <id>.json}).
 */
public record VersionMetadata(
    String id,
    @Nullable String type,
    String mainClass,
    AssetIndexReference assetIndex,
    Map<String, Download> downloads,
    List<Library> libraries,
    @Nullable JavaVersion javaVersion
) {
    public Download client() {
        return Required.member(downloads.get("client"), "downloads.client", id);
    }

    /**
     * Rejects metadata missing the members the download pipelines rely on.
     *
     * @throws com.squareup.moshi.JsonDataException if a required member is missing
     */
    public VersionMetadata validate() {
        var owner = "version " + Required.member(id, "id", "version metadata");
        Required.member(mainClass, "mainClass", owner);
        Required.member(downloads, "downloads", owner);
        var client = client();
        Required.member(client.sha1(), "downloads.client.sha1", owner);
        Required.member(client.url(), "downloads.client.url", owner);

        Required.member(assetIndex, "assetIndex", owner);
        Required.member(assetIndex.id(), "assetIndex.id", owner);
        Required.member(assetIndex.sha1(), "assetIndex.sha1", owner);
        Required.member(assetIndex.url(), "assetIndex.url", owner);

        for (Library library : Required.member(libraries, "libraries", owner)) {
            Required.member(library.name(), "name", "a library of " + owner);
            library.validate();
        }
        return this;
    }

    public record Download(String sha1, long size, String url) {
    }

    public record AssetIndexReference(String id, String sha1, long size, String url) {
    }

    public record JavaVersion(String component, int majorVersion) {
    }
}
