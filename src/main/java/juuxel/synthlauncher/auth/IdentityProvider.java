/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.ReauthenticationRequiredException;

/**
 * The remote calls of a device-code sign-in. Each call is a single round trip;
 * {@link AuthFlow} owns the polling, the session and the account registry around them.
 */
public interface IdentityProvider {
    AuthSession requestDeviceCode(CancellationToken token) throws LauncherException;

    /**
     * Polls the token endpoint once.
     *
     * @throws LauncherException with kind {@code AUTH} if the user declined or the code expired
     */
    TokenPoll pollToken(AuthSession session, CancellationToken token) throws LauncherException;

    /**
     * Mints new tokens from a refresh token.
     *
     * @throws ReauthenticationRequiredException if the refresh token is no longer accepted
     */
    OAuthTokens refresh(String refreshToken, CancellationToken token) throws LauncherException;

    /** Exchanges OAuth tokens for a game session and the player's profile. */
    MinecraftLogin logIn(OAuthTokens tokens, CancellationToken token) throws LauncherException;
}
