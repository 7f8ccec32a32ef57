/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.DependencyCoordinates;
import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.Library;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.LauncherException;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Downloads the libraries allowed on the configured operating system, extracts their
 * native archives and produces the class path. Progress counts files.
 */
public final class LibraryPipeline extends FilePipeline<String> {
    public LibraryPipeline() {
        super("libraries", Unit.FILES);
    }

    @Override
    protected List<FileDownload> files(LauncherConfig config, ResolvedVersion version) {
        var layout = layout(config, version);
        List<FileDownload> files = new ArrayList<>(layout.classPath().values());
        files.addAll(layout.natives());
        return files;
    }

    @Override
    protected String finish(LauncherConfig config, ResolvedVersion version, CancellationToken token) throws LauncherException {
        var layout = layout(config, version);

        for (FileDownload nativeJar : layout.natives()) {
            NativeExtractor.extract(nativeJar.target(), config.nativesDirectory(), token);
        }

        return layout.classPath()
            .keySet()
            .stream()
            .map(Path::toString)
            .collect(Collectors.joining(File.pathSeparator));
    }

    Layout layout(LauncherConfig config, ResolvedVersion version) {
        Path root = config.librariesDirectory();
        Map<Path, FileDownload> classPath = new LinkedHashMap<>();
        List<FileDownload> natives = new ArrayList<>();

        for (Library library : version.metadata().libraries()) {
            if (!library.isAllowedOn(config.os())) continue;

            var coordinates = DependencyCoordinates.parse(library.name());
            var downloads = library.downloads();
            var nativeClassifier = library.nativeClassifier(config.os());

            if (downloads == null) {
                // Old metadata only names the artifact; fetch it from the library repository without a hash
                var file = new FileDownload(
                    coordinates.toMavenUrl(config.endpoints().libraries()),
                    root.resolve(coordinates.toUrlPart()),
                    null,
                    0
                );
                classPath.putIfAbsent(file.target(), file);
                continue;
            }

            var artifact = downloads.artifact();
            if (artifact != null) {
                var file = toDownload(root, coordinates, artifact);
                classPath.putIfAbsent(file.target(), file);
            }

            if (nativeClassifier != null && downloads.classifiers() != null) {
                var nativeArtifact = downloads.classifiers().get(nativeClassifier);
                if (nativeArtifact != null) {
                    natives.add(toDownload(root, coordinates.withClassifier(nativeClassifier), nativeArtifact));
                }
            }
        }

        return new Layout(classPath, natives);
    }

    private static FileDownload toDownload(Path root, DependencyCoordinates coordinates, Library.Artifact artifact) {
        var path = artifact.path() != null ? artifact.path() : coordinates.toUrlPart();
        return new FileDownload(artifact.url(), root.resolve(path), artifact.sha1(), artifact.size());
    }

    /**
     * @param classPath class path entries in library order, keyed by their location
     * @param natives   native archives to extract after downloading
     */
    record Layout(Map<Path, FileDownload> classPath, List<FileDownload> natives) {
    }
}
