/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.resolve;

import juuxel.synthlauncher.FakeVersion;
import juuxel.synthlauncher.TestServer;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.TaskRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static juuxel.synthlauncher.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ManifestResolverTest {
    private final TestServer server = TestServer.start();
    private final TaskRunner runner = new TaskRunner();
    private final ManifestResolver resolver = new ManifestResolver(runner);

    @TempDir
    Path tempDir;

    private LauncherState state;

    @BeforeEach
    void setUp() throws LauncherException {
        state = state(tempDir, server);
    }

    @AfterEach
    void tearDown() {
        runner.close();
        server.close();
    }

    @Test
    void resolveManifest_shouldPopulateTheStateAndCache() throws LauncherException {
        serveManifest(server, new FakeVersion(server, "1.20.4").publish(), new FakeVersion(server, "1.20.3").publish());

        var manifest = complete(resolver.resolveManifest(state));

        assertEquals(2, manifest.versions().size());
        assertEquals(2, state.manifestLength());
        assertEquals("1.20.3", state.versionName(1));
        assertTrue(Files.isRegularFile(ManifestResolver.cacheFile(state)));
    }

    @Test
    void resolveManifest_shouldReplaceThePreviousManifest() throws LauncherException {
        serveManifest(server, new FakeVersion(server, "1.20.4").publish(), new FakeVersion(server, "1.20.3").publish());
        complete(resolver.resolveManifest(state));

        serveManifest(server, new FakeVersion(server, "24w03a").publish());
        complete(resolver.resolveManifest(state));

        assertEquals(1, state.manifestLength());
        assertEquals("24w03a", state.versionName(0));
    }

    @Test
    void resolveManifest_shouldRetryServerErrors() throws LauncherException {
        serveManifest(server, new FakeVersion(server, "1.20.4").publish());
        server.failFirst(MANIFEST_PATH, 1, 503);

        complete(resolver.resolveManifest(state));

        assertEquals(2, server.hits(MANIFEST_PATH));
        assertEquals(1, state.manifestLength());
    }

    @Test
    void resolveManifest_shouldFailWithNetworkWhenRetriesRunOut() {
        server.status(MANIFEST_PATH, 500, "");

        var e = assertThrows(LauncherException.class, () -> complete(resolver.resolveManifest(state)));

        assertEquals(ErrorKind.NETWORK, e.kind());
        assertEquals(state.config().retries(), server.hits(MANIFEST_PATH));
        assertFalse(state.hasManifest());
    }

    @Test
    void resolveManifest_shouldFailWithParseOnMalformedJson() {
        server.serve(MANIFEST_PATH, "{\"latest\": {\"release\": ");

        var e = assertThrows(LauncherException.class, () -> complete(resolver.resolveManifest(state)));

        assertEquals(ErrorKind.PARSE, e.kind());
        assertEquals(1, server.hits(MANIFEST_PATH));
        assertFalse(state.hasManifest());
    }

    @Test
    void resolveManifest_shouldKeepTheOldManifestOnFailure() throws LauncherException {
        serveManifest(server, new FakeVersion(server, "1.20.4").publish());
        complete(resolver.resolveManifest(state));
        server.status(MANIFEST_PATH, 404, "");

        assertThrows(LauncherException.class, () -> complete(resolver.resolveManifest(state)));

        assertEquals("1.20.4", state.versionName(0));
    }

    @Test
    void resolveManifest_shouldFailWithParseWhenMembersAreMissing() {
        server.serve(MANIFEST_PATH, "{}");

        var e = assertThrows(LauncherException.class, () -> complete(resolver.resolveManifest(state)));

        assertEquals(ErrorKind.PARSE, e.kind());
        assertFalse(state.hasManifest());
        assertThrows(LauncherException.class, state::manifestLength);
        assertFalse(Files.exists(ManifestResolver.cacheFile(state)));
    }
}
