/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import java.util.Locale;

/**
 * The operating systems library rules and native classifiers know about.
 */
public enum OperatingSystem {
    WINDOWS("windows", ".dll"),
    OSX("osx", ".dylib"),
    LINUX("linux", ".so");

    private final String id;
    private final String nativeSuffix;

    OperatingSystem(String id, String nativeSuffix) {
        this.id = id;
        this.nativeSuffix = nativeSuffix;
    }

    public String id() {
        return id;
    }

    public String nativeSuffix() {
        return nativeSuffix;
    }

    public String arch() {
        return System.getProperty("os.arch");
    }

    /** Replacement for {@code ${arch}} in native classifiers. */
    public String bits() {
        return arch().contains("64") ? "64" : "32";
    }

    public static OperatingSystem current() {
        var name = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) return WINDOWS;
        if (name.startsWith("mac") || name.contains("darwin")) return OSX;
        return LINUX;
    }

    public static OperatingSystem byId(String id) {
        for (OperatingSystem os : values()) {
            if (os.id.equals(id)) return os;
        }

        throw new IllegalArgumentException("Unknown operating system: " + id);
    }
}
