/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

/**
 * The kinds of terminal outcomes a {@link Task} can report besides success.
 */
public enum ErrorKind {
    /** The task was cancelled before it produced a value. Not a failure. */
    CANCELLED,
    /** A remote service could not be reached or answered with an error status. */
    NETWORK,
    /** A remote or local document could not be parsed. */
    PARSE,
    /** A local file could not be read or written, or its hash did not match. */
    IO,
    /** The identity provider denied, expired or rejected the credentials. */
    AUTH,
    /** The operation was invoked before the state it depends on was available. */
    PRECONDITION,
}
