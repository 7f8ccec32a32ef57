/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

/**
 * The remote services the launcher talks to.
 */
public record Endpoints(
    String versionManifest,
    String resources,
    String libraries,
    String deviceCode,
    String token,
    String xboxUserAuth,
    String xstsAuthorize,
    String minecraftLogin,
    String minecraftProfile
) {
    public static final Endpoints DEFAULT = new Endpoints(
        "https://piston-meta.mojang.com/mc/game/version_manifest_v2.json",
        "https://resources.download.minecraft.net",
        "https://libraries.minecraft.net",
        "https://login.microsoftonline.com/consumers/oauth2/v2.0/devicecode",
        "https://login.microsoftonline.com/consumers/oauth2/v2.0/token",
        "https://user.auth.xboxlive.com/user/authenticate",
        "https://xsts.auth.xboxlive.com/xsts/authorize",
        "https://api.minecraftservices.com/authentication/login_with_xbox",
        "https://api.minecraftservices.com/minecraft/profile"
    );

    /** Points every endpoint at one base URL, keeping the default paths. Used for local mirrors. */
    public static Endpoints under(String base) {
        return new Endpoints(
            base + "/mc/game/version_manifest_v2.json",
            base + "/resources",
            base + "/libraries",
            base + "/oauth2/devicecode",
            base + "/oauth2/token",
            base + "/user/authenticate",
            base + "/xsts/authorize",
            base + "/authentication/login_with_xbox",
            base + "/minecraft/profile"
        );
    }
}
