/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import java.time.Instant;

/**
 * A signed-in account.
 *
 * @param expiry the access token's expiry in epoch seconds
 */
public record Account(MinecraftProfile profile, String accessToken, String refreshToken, long expiry) {
    public String displayName() {
        return profile.name();
    }

    public boolean needsRefresh(Instant now) {
        return expiry <= now.getEpochSecond();
    }

    public boolean needsRefresh() {
        return needsRefresh(Instant.now());
    }
}
