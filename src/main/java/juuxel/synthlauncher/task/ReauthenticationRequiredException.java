/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

/**
 * Thrown when a stored refresh token is no longer accepted. The account has to go
 * through the device-code flow again; retrying the refresh will not help.
 */
public final class ReauthenticationRequiredException extends LauncherException {
    public ReauthenticationRequiredException(String message) {
        super(ErrorKind.AUTH, message);
    }
}
