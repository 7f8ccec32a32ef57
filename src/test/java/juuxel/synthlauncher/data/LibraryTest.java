/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import juuxel.synthlauncher.OperatingSystem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LibraryTest {
    private static Library withRules(Library.Rule... rules) {
        return new Library("org.example:lib:1.0", null, List.of(rules), null);
    }

    private static Library.Rule allow(String os) {
        return new Library.Rule(Library.Action.ALLOW, os == null ? null : new Library.Os(os, null));
    }

    private static Library.Rule disallow(String os) {
        return new Library.Rule(Library.Action.DISALLOW, new Library.Os(os, null));
    }

    @Test
    void isAllowedOn_shouldAllowLibrariesWithoutRules() {
        var library = new Library("org.example:lib:1.0", null, null, null);

        for (OperatingSystem os : OperatingSystem.values()) {
            assertTrue(library.isAllowedOn(os));
        }
    }

    @Test
    void isAllowedOn_shouldDisallowWhenNoRuleMatches() {
        var library = withRules(allow("osx"));

        assertTrue(library.isAllowedOn(OperatingSystem.OSX));
        assertFalse(library.isAllowedOn(OperatingSystem.LINUX));
    }

    @Test
    void isAllowedOn_shouldLetTheLastMatchingRuleDecide() {
        var library = withRules(allow(null), disallow("osx"));

        assertTrue(library.isAllowedOn(OperatingSystem.LINUX));
        assertTrue(library.isAllowedOn(OperatingSystem.WINDOWS));
        assertFalse(library.isAllowedOn(OperatingSystem.OSX));
    }

    @Test
    void nativeClassifier_shouldSubstituteTheArchitecture() {
        var library = new Library("org.lwjgl.lwjgl:lwjgl-platform:2.9.4", null, null,
            Map.of("windows", "natives-windows-${arch}", "linux", "natives-linux"));

        assertEquals("natives-windows-" + OperatingSystem.WINDOWS.bits(), library.nativeClassifier(OperatingSystem.WINDOWS));
        assertEquals("natives-linux", library.nativeClassifier(OperatingSystem.LINUX));
        assertNull(library.nativeClassifier(OperatingSystem.OSX));
    }

    @Test
    void nativeClassifier_shouldBeNullWithoutNatives() {
        assertNull(new Library("org.example:lib:1.0", null, null, null).nativeClassifier(OperatingSystem.LINUX));
    }
}
