/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * One file a pipeline fetches.
 *
 * @param sha1 the expected hash, or {@code null} if the source does not declare one
 *             (then any existing file is trusted)
 */
public record FileDownload(String url, Path target, @Nullable String sha1, long size) {
}
