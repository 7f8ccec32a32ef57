/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Session-wide launcher settings.
 *
 * @param dataDirectory root of every file the launcher writes
 * @param concurrency   concurrent file transfers per download pipeline
 * @param retries       attempts per file before a pipeline gives up
 * @param pollInterval  how often the host loop polls outstanding tasks
 * @param clientId      OAuth client id registered with the identity provider
 * @param os            the system used to evaluate library rules
 */
public record LauncherConfig(
    Path dataDirectory,
    Endpoints endpoints,
    int concurrency,
    int retries,
    Duration pollInterval,
    String clientId,
    OperatingSystem os
) {
    public static final String DEFAULT_CLIENT_ID = "04bc8538-fc3c-4490-9e61-a2b3f4cbcf5c";
    public static final int DEFAULT_CONCURRENCY = 16;
    public static final int DEFAULT_RETRIES = 3;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);

    public LauncherConfig {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be positive, was " + concurrency);
        if (retries < 1) throw new IllegalArgumentException("retries must be positive, was " + retries);
    }

    public static LauncherConfig defaults(Path dataDirectory) {
        return new LauncherConfig(
            dataDirectory,
            Endpoints.DEFAULT,
            DEFAULT_CONCURRENCY,
            DEFAULT_RETRIES,
            DEFAULT_POLL_INTERVAL,
            DEFAULT_CLIENT_ID,
            OperatingSystem.current()
        );
    }

    public LauncherConfig withEndpoints(Endpoints endpoints) {
        return new LauncherConfig(dataDirectory, endpoints, concurrency, retries, pollInterval, clientId, os);
    }

    public LauncherConfig withOs(OperatingSystem os) {
        return new LauncherConfig(dataDirectory, endpoints, concurrency, retries, pollInterval, clientId, os);
    }

    public Path versionsDirectory() {
        return dataDirectory.resolve("versions");
    }

    public Path assetsDirectory() {
        return dataDirectory.resolve("assets");
    }

    public Path librariesDirectory() {
        return dataDirectory.resolve("libraries");
    }

    public Path nativesDirectory() {
        return dataDirectory.resolve("natives");
    }
}
