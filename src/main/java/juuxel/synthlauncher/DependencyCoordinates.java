/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import org.jetbrains.annotations.Nullable;

public record DependencyCoordinates(
    String group,
    String name,
    String version,
    @Nullable String classifier
) {
    public DependencyCoordinates(String group, String name, String version) {
        this(group, name, version, null);
    }

    /**
     * Parses {@code group:name:version} or {@code group:name:version:classifier}.
     */
    public static DependencyCoordinates parse(String notation) {
        var parts = notation.split(":");

        return switch (parts.length) {
            case 3 -> new DependencyCoordinates(parts[0], parts[1], parts[2]);
            case 4 -> new DependencyCoordinates(parts[0], parts[1], parts[2], parts[3]);
            default -> throw new IllegalArgumentException("Invalid dependency notation: " + notation);
        };
    }

    public DependencyCoordinates withClassifier(@Nullable String classifier) {
        return new DependencyCoordinates(group, name, version, classifier);
    }

    public String toUrlPart() {
        var sb = new StringBuilder()
            .append(group.replace('.', '/'))
            .append('/')
            .append(name)
            .append('/')
            .append(version)
            .append('/')
            .append(name)
            .append('-')
            .append(version);

        if (classifier != null) {
            sb.append('-').append(classifier);
        }

        sb.append(".jar");
        return sb.toString();
    }

    public String toMavenUrl(String repository) {
        return (repository.endsWith("/") ? repository : repository + "/") + toUrlPart();
    }
}
