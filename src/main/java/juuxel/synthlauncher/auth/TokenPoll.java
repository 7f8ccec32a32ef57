/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import org.jetbrains.annotations.Nullable;

/**
 * The answer to one poll of the token endpoint. Denied and expired codes are not answers;
 * the provider throws for those.
 */
public record TokenPoll(Status status, @Nullable OAuthTokens tokens) {
    public static final TokenPoll PENDING = new TokenPoll(Status.PENDING, null);
    public static final TokenPoll SLOW_DOWN = new TokenPoll(Status.SLOW_DOWN, null);

    public static TokenPoll granted(OAuthTokens tokens) {
        return new TokenPoll(Status.GRANTED, tokens);
    }

    public enum Status {
        PENDING,
        /** Polling too fast; the interval grows by five seconds. */
        SLOW_DOWN,
        GRANTED,
    }
}
