/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.TaskRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static juuxel.synthlauncher.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class JvmProbeTest {
    @TempDir
    Path tempDir;

    private static final String SETTINGS = """
        Property settings:
            file.encoding = UTF-8
            java.home = /usr/lib/jvm/temurin-17
            java.vendor = Eclipse Adoptium
            java.version = 17.0.10
            java.vm.name = OpenJDK 64-Bit Server VM

        openjdk version "17.0.10" 2024-01-16
        """;

    @Test
    void describe_shouldCombineVendorAndMajorVersion() {
        assertEquals("Eclipse Adoptium 17", JvmProbe.describe(SETTINGS, "java"));
    }

    @Test
    void describe_shouldFallBackWithoutProperties() {
        assertEquals("/opt/java", JvmProbe.describe("Error: could not create the Java Virtual Machine.", "/opt/java"));
    }

    @Test
    void majorVersion_shouldHandleBothVersionSchemes() {
        assertEquals("8", JvmProbe.majorVersion("1.8.0_402"));
        assertEquals("17", JvmProbe.majorVersion("17.0.10"));
        assertEquals("21", JvmProbe.majorVersion("21"));
        assertEquals("22", JvmProbe.majorVersion("22-ea"));
    }

    @Test
    void probe_shouldFailWithIoForAMissingExecutable() {
        var e = assertThrows(LauncherException.class,
            () -> JvmProbe.probe("/nonexistent/bin/java-" + System.nanoTime(), CancellationToken.create()));
        assertEquals(ErrorKind.IO, e.kind());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void probe_shouldDescribeTheExecutableFromItsOutput() throws Exception {
        var executable = script("fake-java", """
            echo 'Property settings:' >&2
            echo '    java.vendor = Test Vendor' >&2
            echo '    java.version = 17.0.1' >&2
            """);

        var jvm = JvmProbe.probe(executable, CancellationToken.create());

        assertEquals("Test Vendor 17", jvm.name());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void probe_shouldStopAHangingExecutableWhenCancelled() throws Exception {
        var executable = script("hanging-java", "sleep 60\n");

        try (var runner = new TaskRunner()) {
            var task = runner.start("Probing", token -> JvmProbe.probe(executable, token));
            Thread.sleep(200);
            long cancelledAt = System.nanoTime();
            task.cancel();

            awaitTerminal(task);

            assertTrue(System.nanoTime() - cancelledAt < 5_000_000_000L, "the probe should stop promptly");
            var e = assertThrows(LauncherException.class, task::await);
            assertEquals(ErrorKind.CANCELLED, e.kind());
        }
    }

    private String script(String name, String body) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file.toString();
    }
}
