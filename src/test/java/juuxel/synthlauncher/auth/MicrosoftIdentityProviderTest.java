/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import juuxel.synthlauncher.TestServer;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.ReauthenticationRequiredException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static juuxel.synthlauncher.TestFixtures.config;
import static org.junit.jupiter.api.Assertions.*;

class MicrosoftIdentityProviderTest {
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final AuthSession SESSION = new AuthSession("ABCD-1234", "https://www.microsoft.com/link", "device-secret",
        Duration.ofSeconds(5), NOW.plusSeconds(900));
    private static final OAuthTokens TOKENS = new OAuthTokens("oauth-access", "oauth-refresh", 3600);

    private final TestServer server = TestServer.start();
    private final CancellationToken token = CancellationToken.create();

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        server.close();
    }

    private MicrosoftIdentityProvider provider() {
        return new MicrosoftIdentityProvider(config(tempDir, server), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void serveXbox() {
        server.serve("/user/authenticate", """
            {"IssueInstant": "2024-01-01T12:00:00Z", "Token": "xbl-token", "DisplayClaims": {"xui": [{"uhs": "4242"}]}}
            """);
        server.serve("/xsts/authorize", """
            {"Token": "xsts-token", "DisplayClaims": {"xui": [{"uhs": "4242"}]}}
            """);
        server.serve("/authentication/login_with_xbox", """
            {"username": "a1b2", "access_token": "game-token", "token_type": "Bearer", "expires_in": 86400}
            """);
    }

    @Test
    void requestDeviceCode_shouldCreateASession() throws LauncherException {
        server.serve("/oauth2/devicecode", """
            {"user_code": "ABCD-1234", "device_code": "device-secret", "verification_uri": "https://www.microsoft.com/link",
             "expires_in": 900, "interval": 5, "message": "To sign in, use a web browser"}
            """);

        var session = provider().requestDeviceCode(token);

        assertEquals("ABCD-1234", session.userCode());
        assertEquals("device-secret", session.deviceCode());
        assertEquals("https://www.microsoft.com/link", session.verificationUrl());
        assertEquals(Duration.ofSeconds(5), session.interval());
        assertEquals(NOW.plusSeconds(900), session.expiresAt());

        var request = server.requestBodies("/oauth2/devicecode").get(0);
        assertTrue(request.contains("client_id=test-client"), request);
        assertTrue(request.contains("scope=XboxLive.signin+offline_access"), request);
    }

    @Test
    void requestDeviceCode_shouldFailWithNetworkOnServerErrors() {
        server.status("/oauth2/devicecode", 503, "");

        var e = assertThrows(LauncherException.class, () -> provider().requestDeviceCode(token));
        assertEquals(ErrorKind.NETWORK, e.kind());
    }

    @Test
    void pollToken_shouldReportPendingAndSlowDown() throws LauncherException {
        server.respond("/oauth2/token", (call, body) -> TestServer.Response.json(400,
            call == 1 ? "{\"error\": \"authorization_pending\"}" : "{\"error\": \"slow_down\"}"));

        assertEquals(TokenPoll.PENDING, provider().pollToken(SESSION, token));
        assertEquals(TokenPoll.SLOW_DOWN, provider().pollToken(SESSION, token));

        var request = server.requestBodies("/oauth2/token").get(0);
        assertTrue(request.contains("device_code=device-secret"), request);
        assertTrue(request.contains("grant_type=urn%3Aietf%3Aparams%3Aoauth%3Agrant-type%3Adevice_code"), request);
    }

    @Test
    void pollToken_shouldReturnGrantedTokens() throws LauncherException {
        server.serve("/oauth2/token", """
            {"token_type": "Bearer", "scope": "XboxLive.signin", "access_token": "oauth-access",
             "refresh_token": "oauth-refresh", "expires_in": 3600}
            """);

        var poll = provider().pollToken(SESSION, token);

        assertEquals(TokenPoll.Status.GRANTED, poll.status());
        assertEquals(TOKENS, poll.tokens());
    }

    @Test
    void pollToken_shouldFailWithAuthWhenDeclinedOrExpired() {
        for (var error : new String[] { "authorization_declined", "expired_token", "bad_verification_code" }) {
            server.status("/oauth2/token", 400, "{\"error\": \"" + error + "\"}");

            var e = assertThrows(LauncherException.class, () -> provider().pollToken(SESSION, token));
            assertEquals(ErrorKind.AUTH, e.kind(), error);
        }
    }

    @Test
    void refresh_shouldRequireReauthenticationOnInvalidGrant() {
        server.status("/oauth2/token", 400, "{\"error\": \"invalid_grant\", \"error_description\": \"AADSTS70000\"}");

        var e = assertThrows(ReauthenticationRequiredException.class, () -> provider().refresh("revoked", token));
        assertTrue(e.getMessage().contains("AADSTS70000"));
    }

    @Test
    void refresh_shouldSendTheRefreshToken() throws LauncherException {
        server.serve("/oauth2/token", "{\"access_token\": \"new-access\", \"refresh_token\": \"new-refresh\", \"expires_in\": 3600}");

        var tokens = provider().refresh("old-refresh", token);

        assertEquals(new OAuthTokens("new-access", "new-refresh", 3600), tokens);
        var request = server.requestBodies("/oauth2/token").get(0);
        assertTrue(request.contains("grant_type=refresh_token"), request);
        assertTrue(request.contains("refresh_token=old-refresh"), request);
    }

    @Test
    void logIn_shouldChainXboxAndGameServices() throws LauncherException {
        serveXbox();
        server.serve("/minecraft/profile", "{\"id\": \"069a79f444e94726a5befca90e38aaf5\", \"name\": \"Notch\", \"skins\": []}");

        var login = provider().logIn(TOKENS, token);

        assertEquals("Notch", login.profile().name());
        assertEquals("069a79f444e94726a5befca90e38aaf5", login.profile().id());
        assertEquals("game-token", login.accessToken());
        assertTrue(server.requestBodies("/user/authenticate").get(0).contains("\"RpsTicket\":\"d=oauth-access\""));
        assertTrue(server.requestBodies("/xsts/authorize").get(0).contains("\"UserTokens\":[\"xbl-token\"]"));
        assertTrue(server.requestBodies("/authentication/login_with_xbox").get(0).contains("XBL3.0 x=4242;xsts-token"));
    }

    @Test
    void logIn_shouldFailWithAuthWithoutTheGame() {
        serveXbox();
        server.status("/minecraft/profile", 404, "{\"error\": \"NOT_FOUND\"}");

        var e = assertThrows(LauncherException.class, () -> provider().logIn(TOKENS, token));
        assertEquals(ErrorKind.AUTH, e.kind());
    }

    @Test
    void logIn_shouldFailWithAuthWhenXboxRejects() {
        serveXbox();
        server.status("/xsts/authorize", 401, "{\"XErr\": 2148916233}");

        var e = assertThrows(LauncherException.class, () -> provider().logIn(TOKENS, token));
        assertEquals(ErrorKind.AUTH, e.kind());
        assertEquals(0, server.hits("/authentication/login_with_xbox"));
    }

    @Test
    void logIn_shouldFailWithParseWithoutAUserHash() {
        serveXbox();
        server.serve("/user/authenticate", "{\"Token\": \"xbl-token\", \"DisplayClaims\": {}}");
        server.serve("/xsts/authorize", "{\"Token\": \"xsts-token\", \"DisplayClaims\": {}}");

        var e = assertThrows(LauncherException.class, () -> provider().logIn(TOKENS, token));
        assertEquals(ErrorKind.PARSE, e.kind());
    }
}
