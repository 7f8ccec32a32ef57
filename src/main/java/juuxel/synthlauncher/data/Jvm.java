/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

public record Jvm(String name, String path) {
    public static final Jvm SYSTEM_DEFAULT = new Jvm("Default", "java");
}
