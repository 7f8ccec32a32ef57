/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Copies the shared libraries out of native jars, flattening their directory structure.
 */
final class NativeExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(NativeExtractor.class);
    private static final List<String> SUFFIXES = List.of(".so", ".dll", ".dylib");

    private NativeExtractor() {
    }

    static int extract(Path jar, Path targetDirectory, CancellationToken token) throws LauncherException {
        int count = 0;

        try (var zip = new ZipFile(jar.toFile())) {
            Files.createDirectories(targetDirectory);
            var entries = zip.entries();

            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                token.throwIfCancelled("Extracting " + jar.getFileName());
                if (entry.isDirectory() || !isNative(entry.getName())) continue;

                var fileName = entry.getName().substring(entry.getName().lastIndexOf('/') + 1);
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, targetDirectory.resolve(fileName), StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not extract natives from " + jar, e);
        }

        LOGGER.debug("Extracted {} natives from {}", count, jar);
        return count;
    }

    static boolean isNative(String entryName) {
        if (entryName.startsWith("META-INF/")) return false;
        return SUFFIXES.stream().anyMatch(entryName::endsWith);
    }
}
