/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.task;

import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonEncodingException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.CancellationException;

/**
 * The single failure type surfaced by {@link Task#await()}.
 */
public class LauncherException extends Exception {
    private final ErrorKind kind;

    public LauncherException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LauncherException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isCancelled() {
        return kind == ErrorKind.CANCELLED;
    }

    public static LauncherException cancelled(String what) {
        return new LauncherException(ErrorKind.CANCELLED, what + " was cancelled");
    }

    public static LauncherException precondition(String message) {
        return new LauncherException(ErrorKind.PRECONDITION, message);
    }

    /**
     * Converts a failure thrown by task work into a launcher exception.
     * Unchecked exceptions that are not I/O or JSON related are programming errors
     * and are rethrown as they are.
     */
    public static LauncherException of(Throwable cause, String what) {
        if (cause instanceof LauncherException e) {
            return e;
        } else if (cause instanceof JsonDataException || cause instanceof JsonEncodingException) {
            return new LauncherException(ErrorKind.PARSE, what + ": " + cause.getMessage(), cause);
        } else if (cause instanceof InterruptedException
            || cause instanceof InterruptedIOException
            || cause instanceof ClosedByInterruptException
            || cause instanceof CancellationException) {
            return new LauncherException(ErrorKind.CANCELLED, what + " was interrupted", cause);
        } else if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return new LauncherException(ErrorKind.IO, what + ": " + cause.getMessage(), cause);
        } else if (cause instanceof RuntimeException e) {
            throw e;
        } else if (cause instanceof Error e) {
            throw e;
        }

        return new LauncherException(ErrorKind.IO, what + ": " + cause, cause);
    }
}
