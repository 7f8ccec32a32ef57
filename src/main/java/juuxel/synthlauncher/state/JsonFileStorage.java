/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.state;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import juuxel.synthlauncher.Download;
import juuxel.synthlauncher.FileUtil;
import juuxel.synthlauncher.data.LauncherData;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Stores the launcher data as one JSON document, replaced atomically on every commit.
 */
public final class JsonFileStorage implements LauncherStorage {
    public static final String FILE_NAME = "launcher_data.json";
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileStorage.class);

    private final Path file;
    private final JsonAdapter<LauncherData> adapter = Download.moshi().adapter(LauncherData.class).indent("  ");

    public JsonFileStorage(Path file) {
        this.file = file;
    }

    public static JsonFileStorage in(Path dataDirectory) {
        return new JsonFileStorage(dataDirectory.resolve(FILE_NAME));
    }

    public Path file() {
        return file;
    }

    @Override
    public LauncherData read() throws LauncherException {
        if (Files.notExists(file)) {
            LOGGER.debug("No launcher data at {}, starting empty", file);
            return LauncherData.empty();
        }

        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LauncherException(ErrorKind.IO, "Could not read " + file, e);
        }

        try {
            var data = Download.parse(json, LauncherData.class);
            return new LauncherData(
                Objects.requireNonNullElse(data.jvms(), List.of()),
                Objects.requireNonNullElse(data.accounts(), List.of())
            );
        } catch (JsonDataException e) {
            throw new LauncherException(ErrorKind.PARSE, "Corrupt launcher data in " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void commit(LauncherData data) throws LauncherException {
        FileUtil.writeAtomically(file, adapter.toJson(data).getBytes(StandardCharsets.UTF_8));
        LOGGER.debug("Saved {} accounts and {} JVMs to {}", data.accounts().size(), data.jvms().size(), file);
    }
}
