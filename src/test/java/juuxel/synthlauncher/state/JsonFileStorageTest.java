/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.Account;
import juuxel.synthlauncher.data.Jvm;
import juuxel.synthlauncher.data.LauncherData;
import juuxel.synthlauncher.data.MinecraftProfile;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStorageTest {
    @TempDir
    Path tempDir;

    @Test
    void read_shouldBeEmptyWithoutAFile() throws LauncherException {
        var data = JsonFileStorage.in(tempDir).read();

        assertTrue(data.accounts().isEmpty());
        assertTrue(data.jvms().isEmpty());
    }

    @Test
    void commit_shouldBeReadBack() throws LauncherException {
        var storage = JsonFileStorage.in(tempDir.resolve("data"));
        var account = new Account(new MinecraftProfile("0123", "Steve"), "access", "refresh", 1_700_000_000L);
        var jvm = new Jvm("Eclipse Adoptium 21", "/opt/jdk-21/bin/java");

        storage.commit(new LauncherData(List.of(jvm), List.of(account)));
        var data = JsonFileStorage.in(tempDir.resolve("data")).read();

        assertEquals(List.of(account), data.accounts());
        assertEquals(List.of(jvm), data.jvms());
        assertFalse(Files.exists(storage.file().resolveSibling(JsonFileStorage.FILE_NAME + ".tmp")));
    }

    @Test
    void read_shouldFillInMissingLists() throws IOException, LauncherException {
        Files.writeString(tempDir.resolve(JsonFileStorage.FILE_NAME), "{\"jvms\": []}");

        var data = JsonFileStorage.in(tempDir).read();

        assertEquals(List.of(), data.accounts());
    }

    @Test
    void read_shouldFailWithParseOnCorruptData() throws IOException {
        Files.writeString(tempDir.resolve(JsonFileStorage.FILE_NAME), "{\"accounts\": [{\"profile\":");

        var e = assertThrows(LauncherException.class, () -> JsonFileStorage.in(tempDir).read());
        assertEquals(ErrorKind.PARSE, e.kind());
    }

    @Test
    void state_shouldPersistRegistriesOnCommit() throws LauncherException {
        var storage = JsonFileStorage.in(tempDir);
        var state = LauncherState.load(LauncherConfig.defaults(tempDir), storage);
        state.jvms().add(new Jvm("Custom", "/usr/bin/java"));
        state.commit();

        var reloaded = LauncherState.load(LauncherConfig.defaults(tempDir), storage);

        assertEquals(2, reloaded.jvms().size());
        assertEquals("Custom", assertDoesNotThrow(() -> reloaded.jvms().get(1)).name());
    }
}
