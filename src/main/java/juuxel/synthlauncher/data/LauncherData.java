/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import java.util.List;

public record LauncherData(List<Jvm> jvms, List<Account> accounts) {
    public static LauncherData empty() {
        return new LauncherData(List.of(), List.of());
    }
}
