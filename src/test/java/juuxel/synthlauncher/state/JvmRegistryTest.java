/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.data.Jvm;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JvmRegistryTest {
    private static final Jvm TEMURIN = new Jvm("Eclipse Adoptium 17", "/opt/temurin-17/bin/java");

    @Test
    void get_shouldStartWithTheSystemDefault() throws LauncherException {
        var registry = new JvmRegistry(List.of());

        assertEquals(1, registry.size());
        assertEquals(Jvm.SYSTEM_DEFAULT, registry.get(0));
        assertTrue(registry.persisted().isEmpty());
    }

    @Test
    void add_shouldAppendAfterTheDefault() throws LauncherException {
        var registry = new JvmRegistry(List.of());

        assertEquals(1, registry.add(TEMURIN));
        assertEquals(TEMURIN, registry.get(1));
        assertEquals(List.of(TEMURIN), registry.persisted());
        assertEquals(List.of(Jvm.SYSTEM_DEFAULT, TEMURIN), registry.toList());
    }

    @Test
    void remove_shouldRefuseTheSystemDefault() {
        var registry = new JvmRegistry(List.of(TEMURIN));

        var e = assertThrows(LauncherException.class, () -> registry.remove(0));
        assertEquals(ErrorKind.PRECONDITION, e.kind());
        assertEquals(2, registry.size());
    }

    @Test
    void remove_shouldDropTheEntry() throws LauncherException {
        var registry = new JvmRegistry(List.of(TEMURIN));

        assertEquals(TEMURIN, registry.remove(1));
        assertEquals(1, registry.size());
        assertThrows(LauncherException.class, () -> registry.remove(1));
    }
}
