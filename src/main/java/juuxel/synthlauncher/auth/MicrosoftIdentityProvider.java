/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import com.squareup.moshi.Json;
import com.squareup.moshi.JsonDataException;
import juuxel.synthlauncher.Download;
import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.MinecraftProfile;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.ReauthenticationRequiredException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Signs in with a Microsoft account: the consumer OAuth device-code endpoints, then
 * Xbox Live user authentication, XSTS authorization and the Minecraft services login.
 */
public final class MicrosoftIdentityProvider implements IdentityProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(MicrosoftIdentityProvider.class);
    static final String SCOPE = "XboxLive.signin offline_access";
    static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";

    private final LauncherConfig config;
    private final Clock clock;

    public MicrosoftIdentityProvider(LauncherConfig config) {
        this(config, Clock.systemUTC());
    }

    public MicrosoftIdentityProvider(LauncherConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public AuthSession requestDeviceCode(CancellationToken token) throws LauncherException {
        var url = config.endpoints().deviceCode();
        var response = Download.await(Download.form(url, Map.of(
            "client_id", config.clientId(),
            "scope", SCOPE
        )), token, url);
        var body = Download.read(response, DeviceCodeResponse.class, url);

        return new AuthSession(
            body.userCode(),
            body.verificationUri(),
            body.deviceCode(),
            Duration.ofSeconds(body.interval()),
            clock.instant().plusSeconds(body.expiresIn())
        );
    }

    @Override
    public TokenPoll pollToken(AuthSession session, CancellationToken token) throws LauncherException {
        var body = requestTokens(Map.of(
            "grant_type", DEVICE_CODE_GRANT,
            "client_id", config.clientId(),
            "device_code", session.deviceCode()
        ), token);

        if (body.error() == null) return TokenPoll.granted(body.toTokens());

        return switch (body.error()) {
            case "authorization_pending" -> TokenPoll.PENDING;
            case "slow_down" -> TokenPoll.SLOW_DOWN;
            case "authorization_declined" -> throw new LauncherException(ErrorKind.AUTH, "The sign-in was declined");
            case "expired_token" -> throw new LauncherException(ErrorKind.AUTH, "The device code " + session.userCode() + " expired");
            default -> throw new LauncherException(ErrorKind.AUTH, "Sign-in failed: " + body.describeError());
        };
    }

    @Override
    public OAuthTokens refresh(String refreshToken, CancellationToken token) throws LauncherException {
        var body = requestTokens(Map.of(
            "grant_type", "refresh_token",
            "client_id", config.clientId(),
            "scope", SCOPE,
            "refresh_token", refreshToken
        ), token);

        if (body.error() == null) return body.toTokens();
        if (body.error().equals("invalid_grant")) {
            throw new ReauthenticationRequiredException("The stored sign-in is no longer valid: " + body.describeError());
        }

        throw new LauncherException(ErrorKind.AUTH, "Refreshing the sign-in failed: " + body.describeError());
    }

    @Override
    public MinecraftLogin logIn(OAuthTokens tokens, CancellationToken token) throws LauncherException {
        var endpoints = config.endpoints();

        var user = xbox(endpoints.xboxUserAuth(), new XboxUserRequest(
            new XboxUserProperties("RPS", "user.auth.xboxlive.com", "d=" + tokens.accessToken()),
            "http://auth.xboxlive.com",
            "JWT"
        ), XboxUserRequest.class, token);
        var xsts = xbox(endpoints.xstsAuthorize(), new XstsRequest(
            new XstsProperties("RETAIL", List.of(user.token())),
            "rp://api.minecraftservices.com/",
            "JWT"
        ), XstsRequest.class, token);

        var identityToken = "XBL3.0 x=" + xsts.userHash() + ";" + xsts.token();
        var loginResponse = Download.await(
            Download.postJson(endpoints.minecraftLogin(), new MinecraftLoginRequest(identityToken), MinecraftLoginRequest.class),
            token,
            endpoints.minecraftLogin()
        );
        var login = Download.read(loginResponse, MinecraftLoginResponse.class, endpoints.minecraftLogin());

        var profileResponse = Download.await(Download.getAuthorized(endpoints.minecraftProfile(), login.accessToken()), token, endpoints.minecraftProfile());
        if (profileResponse.statusCode() == 404) {
            throw new LauncherException(ErrorKind.AUTH, "This account does not own the game");
        }

        var profile = Download.read(profileResponse, MinecraftProfile.class, endpoints.minecraftProfile());
        LOGGER.debug("Logged in to Minecraft services as {}", profile.name());
        return new MinecraftLogin(profile, login.accessToken());
    }

    private TokenResponse requestTokens(Map<String, String> fields, CancellationToken token) throws LauncherException {
        var url = config.endpoints().token();
        HttpResponse<String> response = Download.await(Download.form(url, fields), token, url);

        // OAuth errors arrive as 400 responses with an error body
        if (response.statusCode() == 400 || response.statusCode() == 401) {
            try {
                return Download.parse(response.body(), TokenResponse.class);
            } catch (JsonDataException e) {
                throw new LauncherException(ErrorKind.PARSE, "Invalid error response from " + url + ": " + e.getMessage(), e);
            }
        }

        return Download.read(response, TokenResponse.class, url);
    }

    private <B> XboxResponse xbox(String url, B request, Class<B> requestType, CancellationToken token) throws LauncherException {
        var response = Download.await(Download.postJson(url, request, requestType), token, url);
        if (response.statusCode() == 401) {
            throw new LauncherException(ErrorKind.AUTH, "Xbox Live rejected the sign-in (" + response.headers().firstValue("x-err").orElse("no details") + ")");
        }

        return Download.read(response, XboxResponse.class, url);
    }

    public record DeviceCodeResponse(
        @Json(name = "user_code") String userCode,
        @Json(name = "device_code") String deviceCode,
        @Json(name = "verification_uri") String verificationUri,
        @Json(name = "expires_in") long expiresIn,
        long interval,
        @Nullable String message
    ) {
    }

    public record TokenResponse(
        @Json(name = "access_token") @Nullable String accessToken,
        @Json(name = "refresh_token") @Nullable String refreshToken,
        @Json(name = "expires_in") @Nullable Long expiresIn,
        @Nullable String error,
        @Json(name = "error_description") @Nullable String errorDescription
    ) {
        OAuthTokens toTokens() throws LauncherException {
            if (accessToken == null || refreshToken == null || expiresIn == null) {
                throw new LauncherException(ErrorKind.PARSE, "The token response is missing its tokens");
            }
            return new OAuthTokens(accessToken, refreshToken, expiresIn);
        }

        String describeError() {
            return errorDescription != null ? error + ": " + errorDescription : String.valueOf(error);
        }
    }

    public record XboxUserRequest(
        @Json(name = "Properties") XboxUserProperties properties,
        @Json(name = "RelyingParty") String relyingParty,
        @Json(name = "TokenType") String tokenType
    ) {
    }

    public record XboxUserProperties(
        @Json(name = "AuthMethod") String authMethod,
        @Json(name = "SiteName") String siteName,
        @Json(name = "RpsTicket") String rpsTicket
    ) {
    }

    public record XstsRequest(
        @Json(name = "Properties") XstsProperties properties,
        @Json(name = "RelyingParty") String relyingParty,
        @Json(name = "TokenType") String tokenType
    ) {
    }

    public record XstsProperties(
        @Json(name = "SandboxId") String sandboxId,
        @Json(name = "UserTokens") List<String> userTokens
    ) {
    }

    public record XboxResponse(
        @Json(name = "Token") String token,
        @Json(name = "DisplayClaims") Map<String, List<Map<String, String>>> displayClaims
    ) {
        String userHash() throws LauncherException {
            var xui = displayClaims.get("xui");
            if (xui == null || xui.isEmpty() || !xui.get(0).containsKey("uhs")) {
                throw new LauncherException(ErrorKind.PARSE, "The Xbox Live response has no user hash");
            }
            return xui.get(0).get("uhs");
        }
    }

    public record MinecraftLoginRequest(String identityToken) {
    }

    public record MinecraftLoginResponse(
        @Json(name = "access_token") String accessToken,
        @Json(name = "expires_in") long expiresIn
    ) {
    }
}
