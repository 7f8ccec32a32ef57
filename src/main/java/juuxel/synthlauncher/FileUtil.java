/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-1 verification and atomic writes for the files the launcher caches.
 */
public final class FileUtil {
    private static final String ALGORITHM = "SHA-1";
    private static final int BUFFER_SIZE = 8192;

    private FileUtil() {
    }

    public static String sha1(Path file) throws IOException {
        var digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String sha1(byte[] data) {
        var digest = newDigest();
        digest.update(data);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Checks whether the file exists and has the expected hash.
     */
    public static boolean isValid(Path file, String expectedSha1) throws LauncherException {
        if (!Files.isRegularFile(file)) return false;

        try {
            return sha1(file).equalsIgnoreCase(expectedSha1);
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not hash " + file, e);
        }
    }

    /**
     * Fails with {@link ErrorKind#IO} unless the downloaded file has the expected hash.
     * A mismatching file is deleted.
     */
    public static void verify(Path file, String expectedSha1) throws LauncherException {
        if (isValid(file, expectedSha1)) return;

        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not delete corrupt file " + file, e);
        }

        throw new LauncherException(ErrorKind.IO, "Hash mismatch for " + file + ", expected " + expectedSha1);
    }

    public static void writeAtomically(Path file, byte[] content) throws LauncherException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");

        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.write(temp, content);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not write " + file, e);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
