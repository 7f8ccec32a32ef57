/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import juuxel.synthlauncher.data.LauncherData;
import juuxel.synthlauncher.task.LauncherException;

/**
 * Loads and saves the persisted registries. Implementations own durability and format.
 */
public interface LauncherStorage {
    LauncherData read() throws LauncherException;

    void commit(LauncherData data) throws LauncherException;
}
