/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import com.squareup.moshi.Json;

public enum ReleaseKind {
    @Json(name = "release") RELEASE,
    @Json(name = "snapshot") SNAPSHOT,
    @Json(name = "old_beta") OLD_BETA,
    @Json(name = "old_alpha") OLD_ALPHA,
}
