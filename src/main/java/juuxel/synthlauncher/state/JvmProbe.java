/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.data.Jvm;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Names a Java executable after its vendor and major version by asking it for its properties.
 */
public final class JvmProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(JvmProbe.class);

    private JvmProbe() {
    }

    public static Jvm probe(String executable, CancellationToken token) throws LauncherException {
        Path output = createOutputFile(executable);

        try {
            var process = start(executable, output);

            try {
                while (!process.waitFor(50, TimeUnit.MILLISECONDS)) {
                    if (token.isCancelled()) {
                        throw LauncherException.cancelled("Probing " + executable);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LauncherException(ErrorKind.CANCELLED, "Probing " + executable + " was interrupted", e);
            } finally {
                if (process.isAlive()) process.destroyForcibly();
            }

            if (process.exitValue() != 0) {
                throw new LauncherException(ErrorKind.IO, executable + " exited with " + process.exitValue());
            }

            return new Jvm(describe(Files.readString(output, StandardCharsets.UTF_8), executable), executable);
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not read the output of " + executable, e);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                LOGGER.warn("Could not delete {}", output, e);
            }
        }
    }

    private static Path createOutputFile(String executable) throws LauncherException {
        try {
            return Files.createTempFile("jvm-probe", ".txt");
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not probe " + executable + ": " + e.getMessage(), e);
        }
    }

    // The output goes to a file so that waiting on the process never blocks on a pipe.
    private static Process start(String executable, Path output) throws LauncherException {
        try {
            // -XshowSettings prints to stderr, which is merged
            return new ProcessBuilder(executable, "-XshowSettings:properties", "-version")
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not run " + executable + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a {@code "<vendor> <major>"} name from {@code -XshowSettings:properties} output.
     * Falls back to the executable when the properties are missing.
     */
    static String describe(String output, String fallback) {
        Map<String, String> properties = new HashMap<>();

        for (String line : output.split("\\R")) {
            int separator = line.indexOf(" = ");
            if (separator > 0) {
                properties.putIfAbsent(line.substring(0, separator).trim(), line.substring(separator + 3).trim());
            }
        }

        var vendor = properties.get("java.vendor");
        var version = properties.get("java.version");
        if (vendor == null || version == null) return fallback;
        return vendor + " " + majorVersion(version);
    }

    static String majorVersion(String version) {
        var parts = version.split("[._-]");
        // 1.8.0_402 style
        if (parts[0].equals("1") && parts.length > 1) return parts[1];
        return parts[0];
    }
}
