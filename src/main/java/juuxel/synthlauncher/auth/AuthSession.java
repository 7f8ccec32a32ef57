/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A pending device-code sign-in. The user enters {@code userCode} at {@code verificationUrl}
 * while one polling loop waits for the provider to grant tokens. Never persisted.
 *
 * @param interval  how long to wait between token polls
 * @param expiresAt when the provider stops accepting the device code
 */
public record AuthSession(String userCode, String verificationUrl, String deviceCode, Duration interval, Instant expiresAt) {
    @Override
    public String toString() {
        // keep the device code out of logs
        return "AuthSession[userCode=" + userCode + ", verificationUrl=" + verificationUrl + "]";
    }
}
