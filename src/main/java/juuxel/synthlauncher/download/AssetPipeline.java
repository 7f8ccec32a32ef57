/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.AssetIndex;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.task.CancellationToken;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Downloads the objects of the asset index into {@code assets/objects/<hh>/<hash>}.
 * Objects are content addressed, so paths sharing a hash are fetched once.
 * Progress counts files; the result is the assets root.
 */
public final class AssetPipeline extends FilePipeline<Path> {
    private static final String OBJECT_FOLDER = "objects";

    public AssetPipeline() {
        super("assets", Unit.FILES);
    }

    @Override
    protected List<FileDownload> files(LauncherConfig config, ResolvedVersion version) {
        Path objects = config.assetsDirectory().resolve(OBJECT_FOLDER);
        String base = config.endpoints().resources();
        Map<String, AssetIndex.AssetObject> unique = new LinkedHashMap<>();

        for (AssetIndex.AssetObject object : version.assetIndex().objects().values()) {
            unique.putIfAbsent(object.hash(), object);
        }

        List<FileDownload> files = new ArrayList<>(unique.size());
        for (AssetIndex.AssetObject object : unique.values()) {
            var path = object.relativePath();
            files.add(new FileDownload(base + "/" + path, objects.resolve(path), object.hash(), object.size()));
        }

        return files;
    }

    @Override
    protected Path finish(LauncherConfig config, ResolvedVersion version, CancellationToken token) {
        return config.assetsDirectory();
    }
}
