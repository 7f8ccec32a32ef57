/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Pollable;
import juuxel.synthlauncher.task.TaskRunner;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * The asset, library and jar pipelines of one version, running side by side.
 *
 * <p>The pipelines are independent: one failing does not stop the others, and each is awaited
 * on its own. {@link #await()} produces a {@link LaunchPlan} only when all three succeeded.
 */
public final class DownloadSet implements Pollable<LaunchPlan> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DownloadSet.class);

    private final ResolvedVersion version;
    private final Path nativesDirectory;
    private final PipelineRun<Path> assets;
    private final PipelineRun<String> libraries;
    private final PipelineRun<Path> jar;

    private DownloadSet(ResolvedVersion version, Path nativesDirectory, PipelineRun<Path> assets, PipelineRun<String> libraries, PipelineRun<Path> jar) {
        this.version = version;
        this.nativesDirectory = nativesDirectory;
        this.assets = assets;
        this.libraries = libraries;
        this.jar = jar;
    }

    /**
     * Starts all three pipelines for the resolved version.
     *
     * @throws LauncherException with a precondition error if no version is fully resolved
     */
    public static DownloadSet start(TaskRunner runner, LauncherState state) throws LauncherException {
        var version = state.resolved();
        var config = state.config();
        return new DownloadSet(
            version,
            config.nativesDirectory(),
            new AssetPipeline().start(runner, config, version),
            new LibraryPipeline().start(runner, config, version),
            new JarPipeline().start(runner, config, version)
        );
    }

    public PipelineRun<Path> assets() {
        return assets;
    }

    public PipelineRun<String> libraries() {
        return libraries;
    }

    public PipelineRun<Path> jar() {
        return jar;
    }

    public List<PipelineRun<?>> runs() {
        return List.of(assets, libraries, jar);
    }

    @Override
    public String name() {
        return "Downloading " + version.id();
    }

    @Override
    public boolean poll() {
        return assets.poll() && libraries.poll() && jar.poll();
    }

    @Override
    public void cancel() {
        runs().forEach(PipelineRun::cancel);
    }

    /**
     * Awaits every pipeline and combines their results.
     *
     * @throws LauncherException the first failure in pipeline order, with the others suppressed;
     *                           a cancellation is only reported if nothing actually failed
     */
    @Override
    public LaunchPlan await() throws LauncherException {
        @Nullable LauncherException failure = null;
        Path assetsRoot = null;
        String classPath = null;
        Path clientJar = null;

        try {
            assetsRoot = assets.await();
        } catch (LauncherException e) {
            failure = merge(failure, e);
        }

        try {
            classPath = libraries.await();
        } catch (LauncherException e) {
            failure = merge(failure, e);
        }

        try {
            clientJar = jar.await();
        } catch (LauncherException e) {
            failure = merge(failure, e);
        }

        if (failure != null) throw failure;

        LOGGER.info("All downloads for {} are complete", version.id());
        return new LaunchPlan(
            version.id(),
            version.metadata().mainClass(),
            classPath,
            clientJar,
            assetsRoot,
            version.metadata().assetIndex().id(),
            nativesDirectory
        );
    }

    private static LauncherException merge(@Nullable LauncherException current, LauncherException next) {
        if (current == null) return next;

        if (current.isCancelled() && !next.isCancelled()) {
            next.addSuppressed(current);
            return next;
        }

        current.addSuppressed(next);
        return current;
    }
}
