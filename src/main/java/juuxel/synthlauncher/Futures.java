/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import com.squareup.moshi.JsonEncodingException;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

public final class Futures {
    private static final Logger LOGGER = LoggerFactory.getLogger(Futures.class);

    private Futures() {
    }

    public static <T> CompletableFuture<T> runFirstSuccessful(
        Predicate<? super Throwable> continueOnErrorPredicate,
        List<Supplier<CompletableFuture<T>>> futures
    ) {
        var iter = futures.iterator();
        CompletableFuture<T> future = iter.next().get();

        while (iter.hasNext()) {
            var next = iter.next();
            future = future.exceptionallyCompose(throwable -> {
                if (continueOnErrorPredicate.test(throwable)) {
                    return next.get();
                }

                throw throwable instanceof RuntimeException e ? e : new CompletionException(throwable);
            });
        }

        return future;
    }

    /**
     * Runs the supplied operation up to {@code attempts} times, retrying only {@linkplain #isTransient transient}
     * failures.
     */
    public static <T> CompletableFuture<T> retrying(int attempts, String what, Supplier<CompletableFuture<T>> supplier) {
        List<Supplier<CompletableFuture<T>>> tries = new ArrayList<>(attempts);

        for (int i = 1; i <= attempts; i++) {
            int attempt = i;
            tries.add(() -> {
                if (attempt > 1) {
                    LOGGER.warn("Retrying {} (attempt {} of {})", what, attempt, attempts);
                }

                return supplier.get();
            });
        }

        return runFirstSuccessful(Futures::isTransient, tries);
    }

    /**
     * Like {@link CompletableFuture#supplyAsync(Supplier, Executor)}, but for work that throws checked exceptions.
     * Those complete the future exceptionally instead of being wrapped in a runtime exception.
     */
    public static <T> CompletableFuture<T> supplyAsync(CheckedSupplier<T> supplier, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Network blips and local I/O failures (including hash mismatches) are transient.
     * The first launcher exception in the cause chain decides; cancellation never is.
     */
    public static boolean isTransient(Throwable throwable) {
        return getCauseChain(throwable)
            .filter(cause -> cause instanceof LauncherException || cause instanceof IOException)
            .findFirst()
            .map(cause -> {
                if (cause instanceof LauncherException e) {
                    return e.kind() == ErrorKind.NETWORK || e.kind() == ErrorKind.IO;
                }

                return !(cause instanceof InterruptedIOException) && !(cause instanceof JsonEncodingException);
            })
            .orElse(false);
    }

    private static Stream<Throwable> getCauseChain(Throwable start) {
        return Stream.iterate(start, Objects::nonNull, Throwable::getCause);
    }

    @FunctionalInterface
    public interface CheckedSupplier<T> {
        T get() throws Exception;
    }
}
