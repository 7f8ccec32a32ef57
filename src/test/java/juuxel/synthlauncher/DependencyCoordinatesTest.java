/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DependencyCoordinatesTest {
    @Test
    void parse_shouldReadThreeParts() {
        var coordinates = DependencyCoordinates.parse("com.mojang:brigadier:1.0.18");

        assertEquals(new DependencyCoordinates("com.mojang", "brigadier", "1.0.18"), coordinates);
        assertNull(coordinates.classifier());
    }

    @Test
    void parse_shouldReadAClassifier() {
        var coordinates = DependencyCoordinates.parse("org.lwjgl:lwjgl:3.3.1:natives-linux");

        assertEquals("natives-linux", coordinates.classifier());
    }

    @Test
    void parse_shouldRejectOtherShapes() {
        assertThrows(IllegalArgumentException.class, () -> DependencyCoordinates.parse("just-a-name"));
        assertThrows(IllegalArgumentException.class, () -> DependencyCoordinates.parse("a:b:c:d:e"));
    }

    @Test
    void toUrlPart_shouldFollowTheMavenLayout() {
        assertEquals(
            "org/lwjgl/lwjgl/3.3.1/lwjgl-3.3.1-natives-linux.jar",
            DependencyCoordinates.parse("org.lwjgl:lwjgl:3.3.1").withClassifier("natives-linux").toUrlPart()
        );
    }

    @Test
    void toMavenUrl_shouldJoinWithOneSlash() {
        var coordinates = DependencyCoordinates.parse("net.sf.jopt-simple:jopt-simple:5.0.4");
        var expected = "https://libraries.minecraft.net/net/sf/jopt-simple/jopt-simple/5.0.4/jopt-simple-5.0.4.jar";

        assertEquals(expected, coordinates.toMavenUrl("https://libraries.minecraft.net"));
        assertEquals(expected, coordinates.toMavenUrl("https://libraries.minecraft.net/"));
    }
}
