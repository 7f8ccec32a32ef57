/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.download;

import juuxel.synthlauncher.Download;
import juuxel.synthlauncher.FileUtil;
import juuxel.synthlauncher.Futures;
import juuxel.synthlauncher.LauncherConfig;
import juuxel.synthlauncher.data.ResolvedVersion;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Progress;
import juuxel.synthlauncher.task.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Downloads a list of files with bounded concurrency, verifying each one and reporting progress.
 *
 * <p>Files that are already present with the right hash are skipped but still counted.
 * Each file is retried on transient failures; the first file that fails for good cancels the
 * rest of this pipeline and becomes the pipeline's failure. Other pipelines are not affected.
 *
 * @param <T> what the pipeline produces once every file is in place
 */
public abstract class FilePipeline<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilePipeline.class);

    private final String name;
    private final Unit unit;

    protected FilePipeline(String name, Unit unit) {
        this.name = name;
        this.unit = unit;
    }

    public String name() {
        return name;
    }

    /**
     * Starts the pipeline for the version currently resolved in the state.
     * Fails with a precondition error at await time if nothing is resolved.
     */
    public PipelineRun<T> start(TaskRunner runner, LauncherState state) {
        var progress = new Progress();
        var task = runner.start("Downloading " + name, token -> run(state.config(), state.resolved(), progress, token));
        return new PipelineRun<>(name, task, progress);
    }

    public PipelineRun<T> start(TaskRunner runner, LauncherConfig config, ResolvedVersion version) {
        var progress = new Progress();
        var task = runner.start("Downloading " + name, token -> run(config, version, progress, token));
        return new PipelineRun<>(name, task, progress);
    }

    protected abstract List<FileDownload> files(LauncherConfig config, ResolvedVersion version) throws LauncherException;

    /**
     * Produces the result once all files are present.
     */
    protected abstract T finish(LauncherConfig config, ResolvedVersion version, CancellationToken token) throws LauncherException;

    T run(LauncherConfig config, ResolvedVersion version, Progress progress, CancellationToken token) throws LauncherException {
        var files = files(config, version);
        progress.begin(unit == Unit.FILES ? files.size() : files.stream().mapToLong(FileDownload::size).sum());

        List<FileDownload> missing = new ArrayList<>();
        for (FileDownload file : files) {
            token.throwIfCancelled("Downloading " + name);

            if (isPresent(file)) {
                progress.advance(unit == Unit.FILES ? 1 : file.size());
            } else {
                missing.add(file);
            }
        }

        LOGGER.info("{}: {} files, {} to download", name, files.size(), missing.size());
        if (!missing.isEmpty()) {
            downloadAll(config, missing, progress, token);
        }

        return finish(config, version, token);
    }

    private void downloadAll(LauncherConfig config, List<FileDownload> files, Progress progress, CancellationToken token) throws LauncherException {
        var siblings = token.child();
        var failure = new AtomicReference<Throwable>();
        var threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.concurrency(), files.size()), runnable -> {
            var thread = new Thread(runnable, "synth-" + name + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            var futures = files.stream()
                .map(file -> {
                    var reported = new AtomicLong();
                    return Futures.retrying(
                            config.retries(),
                            file.url(),
                            () -> Futures.supplyAsync(() -> fetch(file, progress, reported, siblings), executor)
                        )
                        .whenComplete((unused, throwable) -> {
                            if (throwable != null && failure.compareAndSet(null, unwrap(throwable))) {
                                LOGGER.debug("{}: {} failed, cancelling the remaining downloads", name, file.url());
                                siblings.cancel();
                            }
                        });
                })
                .toArray(CompletableFuture[]::new);

            Download.await(CompletableFuture.allOf(futures), token, "Downloading " + name);
        } catch (LauncherException e) {
            var first = failure.get();
            if (token.isCancelled() || first == null) throw e;
            throw LauncherException.of(first, "Downloading " + name);
        } finally {
            executor.shutdownNow();
        }
    }

    private Void fetch(FileDownload file, Progress progress, AtomicLong reported, CancellationToken token) throws LauncherException {
        token.throwIfCancelled(file.url());
        // Bytes of a failed attempt stay counted; a retry only reports what goes past them
        var written = new AtomicLong();
        Download.toFile(file.url(), file.target(), token, bytes -> {
            long total = written.addAndGet(bytes);
            if (unit == Unit.BYTES) {
                long previous = reported.getAndAccumulate(total, Math::max);
                if (total > previous) progress.advance(total - previous);
            }
        });

        if (file.sha1() != null) {
            FileUtil.verify(file.target(), file.sha1());
        }

        if (unit == Unit.FILES) {
            progress.advance(1);
        } else {
            long previous = reported.getAndAccumulate(file.size(), Math::max);
            if (file.size() > previous) progress.advance(file.size() - previous);
        }

        return null;
    }

    private static boolean isPresent(FileDownload file) throws LauncherException {
        return file.sha1() == null ? Files.isRegularFile(file.target()) : FileUtil.isValid(file.target(), file.sha1());
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable;
    }

    public enum Unit {
        FILES,
        BYTES,
    }
}
