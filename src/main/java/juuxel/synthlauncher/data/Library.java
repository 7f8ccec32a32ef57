/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.data;

import com.squareup.moshi.Json;
import juuxel.synthlauncher.OperatingSystem;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

public record Library(
    String name,
    @Nullable Downloads downloads,
    @Nullable List<Rule> rules,
    @Nullable Map<String, String> natives
) {
    /**
     * Evaluates the library's rules. Without rules a library is always used;
     * otherwise the last matching rule decides, and nothing matching means disallowed.
     */
    public boolean isAllowedOn(OperatingSystem os) {
        if (rules == null || rules.isEmpty()) return true;

        var action = Action.DISALLOW;
        for (Rule rule : rules) {
            if (rule.matches(os)) {
                action = rule.action();
            }
        }

        return action == Action.ALLOW;
    }

    void validate() {
        if (downloads == null) return;
        if (downloads.artifact() != null) downloads.artifact().validate(name);
        if (downloads.classifiers() != null) {
            downloads.classifiers().forEach((classifier, artifact) -> artifact.validate(name + ":" + classifier));
        }
    }

    /**
     * The native classifier key for the given system, such as {@code natives-windows-64},
     * or {@code null} if the library has no natives for it.
     */
    public @Nullable String nativeClassifier(OperatingSystem os) {
        if (natives == null) return null;
        var classifier = natives.get(os.id());
        return classifier == null ? null : classifier.replace("${arch}", os.bits());
    }

    public record Downloads(@Nullable Artifact artifact, @Nullable Map<String, Artifact> classifiers) {
    }

    public record Artifact(@Nullable String path, String sha1, long size, String url) {
        void validate(String owner) {
            Required.member(sha1, "sha1", owner);
            Required.member(url, "url", owner);
        }
    }

    public record Rule(Action action, @Nullable Os os) {
        boolean matches(OperatingSystem system) {
            if (os == null) return true;
            if (os.name() != null && !os.name().equals(system.id())) return false;
            return os.arch() == null || os.arch().equals(system.arch());
        }
    }

    public record Os(@Nullable String name, @Nullable String arch) {
    }

    public enum Action {
        @Json(name = "allow") ALLOW,
        @Json(name = "disallow") DISALLOW,
    }
}
