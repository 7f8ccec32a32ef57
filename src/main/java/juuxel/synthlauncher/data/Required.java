/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import com.squareup.moshi.JsonDataException;
import org.jetbrains.annotations.Nullable;

final class Required {
    private Required() {
    }

    static <T> T member(@Nullable T value, String name, String owner) {
        if (value == null) throw new JsonDataException("Required member '" + name + "' missing in " + owner);
        return value;
    }
}
