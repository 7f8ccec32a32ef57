/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import java.io.File;
import java.nio.file.Path;

/**
 * Everything a launch needs from the three download pipelines. Only exists once all of them succeeded.
 *
 * @param libraryClassPath the libraries' class path, without the client jar
 */
public record LaunchPlan(
    String versionId,
    String mainClass,
    String libraryClassPath,
    Path clientJar,
    Path assetsRoot,
    String assetIndexId,
    Path nativesDirectory
) {
    /** The full class path: libraries followed by the client jar. */
    public String classPath() {
        if (libraryClassPath.isEmpty()) return clientJar.toString();
        return libraryClassPath + File.pathSeparator + clientJar;
    }
}
