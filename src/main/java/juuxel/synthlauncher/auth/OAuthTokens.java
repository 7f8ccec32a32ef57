/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

/**
 * Tokens granted by the OAuth token endpoint.
 *
 * @param expiresIn lifetime of the access token in seconds
 */
public record OAuthTokens(String accessToken, String refreshToken, long expiresIn) {
    @Override
    public String toString() {
        return "OAuthTokens[expiresIn=" + expiresIn + "]";
    }
}
