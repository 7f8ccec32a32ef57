/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.task.CancellationToken;

import java.nio.file.Path;
import java.util.List;

/**
 * Downloads the client jar to {@code versions/<id>/<id>.jar}. Progress counts bytes.
 */
public final class JarPipeline extends FilePipeline<Path> {
    public JarPipeline() {
        super("jar", Unit.BYTES);
    }

    public static Path jarPath(LauncherConfig config, String versionId) {
        return config.versionsDirectory().resolve(versionId).resolve(versionId + ".jar");
    }

    @Override
    protected List<FileDownload> files(LauncherConfig config, ResolvedVersion version) {
        var client = version.metadata().client();
        return List.of(new FileDownload(client.url(), jarPath(config, version.id()), client.sha1(), client.size()));
    }

    @Override
    protected Path finish(LauncherConfig config, ResolvedVersion version, CancellationToken token) {
        return jarPath(config, version.id());
    }
}
