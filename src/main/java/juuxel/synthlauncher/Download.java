/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher;

import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonEncodingException;
import com.squareup.moshi.Moshi;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;

public final class Download {
    private static final Logger LOGGER = LoggerFactory.getLogger(Download.class);
    private static final Duration CANCEL_CHECK_INTERVAL = Duration.ofMillis(25);
    private static final int BUFFER_SIZE = 8192;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    static final ExecutorService EXECUTOR = Executors.newFixedThreadPool(16, runnable -> {
        var thread = new Thread(runnable, "synth-http-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });
    private static final HttpClient CLIENT = HttpClient.newBuilder()
        .executor(EXECUTOR)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(30))
        .build();
    private static final Moshi MOSHI = new Moshi.Builder().build();

    private Download() {
    }

    public static Moshi moshi() {
        return MOSHI;
    }

    public static <T> CompletableFuture<HttpResponse<T>> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler) {
        LOGGER.debug("{} {}", request.method(), request.uri());
        return CLIENT.sendAsync(request, bodyHandler);
    }

    public static <T> CompletableFuture<HttpResponse<T>> download(String url, HttpResponse.BodyHandler<T> bodyHandler) {
        var request = HttpRequest.newBuilder()
            .GET()
            .uri(URI.create(url))
            .build();
        return send(request, bodyHandler);
    }

    public static CompletableFuture<byte[]> bytes(String url) {
        return download(url, responseInfo -> {
            if (isSuccess(responseInfo.statusCode())) {
                return HttpResponse.BodySubscribers.ofByteArray();
            }

            throw new UncheckedIOException(new StatusCodeException(url, responseInfo.statusCode()));
        }).thenApply(HttpResponse::body);
    }

    public static <T> CompletableFuture<T> json(String url, Class<T> clazz) {
        return bytes(url).thenApply(body -> parse(body, clazz));
    }

    public static CompletableFuture<HttpResponse<String>> form(String url, Map<String, String> fields) {
        var body = fields.entrySet()
            .stream()
            .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
            .collect(Collectors.joining("&"));
        var request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    public static <B> CompletableFuture<HttpResponse<String>> postJson(String url, B body, Class<B> bodyType) {
        var request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(MOSHI.adapter(bodyType).toJson(body)))
            .build();
        return send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    public static CompletableFuture<HttpResponse<String>> getAuthorized(String url, String bearerToken) {
        var request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Authorization", "Bearer " + bearerToken)
            .header("Accept", "application/json")
            .GET()
            .build();
        return send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    /**
     * Parses a successful response body, or fails with the response's status code.
     */
    public static <T> T parseResponse(HttpResponse<String> response, Class<T> clazz) {
        if (!isSuccess(response.statusCode())) {
            throw new UncheckedIOException(new StatusCodeException(response.uri().toString(), response.statusCode()));
        }

        return parse(response.body(), clazz);
    }

    /**
     * Like {@link #parseResponse}, but reports failures as launcher exceptions:
     * bad statuses as network errors and bad bodies as parse errors.
     */
    public static <T> T read(HttpResponse<String> response, Class<T> clazz, String what) throws LauncherException {
        try {
            return parseResponse(response, clazz);
        } catch (UncheckedIOException | JsonDataException e) {
            throw classify(e, what);
        }
    }

    public static <T> T parse(byte[] json, Class<T> clazz) {
        return parse(new String(json, StandardCharsets.UTF_8), clazz);
    }

    public static <T> T parse(String json, Class<T> clazz) {
        try {
            T value = MOSHI.adapter(clazz).fromJson(json);
            if (value == null) throw new JsonDataException("Expected " + clazz.getSimpleName() + " but was null");
            return value;
        } catch (IOException e) {
            // reading from memory, so this is always malformed or truncated input
            throw new JsonDataException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Waits for a future on the calling thread while watching the token.
     * A cancelled token cancels the future, which aborts the underlying exchange.
     */
    public static <T> T await(CompletableFuture<T> future, CancellationToken token, String what) throws LauncherException {
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                throw LauncherException.cancelled(what);
            }

            try {
                return future.get(CANCEL_CHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // check the token again
            } catch (CancellationException e) {
                throw new LauncherException(ErrorKind.CANCELLED, what + " was cancelled", e);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new LauncherException(ErrorKind.CANCELLED, what + " was interrupted", e);
            } catch (ExecutionException e) {
                throw classify(e.getCause(), what);
            }
        }
    }

    /**
     * Streams a URL into the target file, checking the token between chunks.
     * The bytes land in a {@code .tmp} sibling which is moved into place once complete.
     *
     * @param onBytes receives the size of every chunk written
     */
    public static void toFile(String url, Path target, CancellationToken token, LongConsumer onBytes) throws LauncherException {
        HttpResponse<InputStream> response = await(download(url, HttpResponse.BodyHandlers.ofInputStream()), token, url);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try (InputStream in = response.body()) {
            if (!isSuccess(response.statusCode())) {
                throw classify(new StatusCodeException(url, response.statusCode()), url);
            }

            // only local file operations throw IOException in here, reads go through readChunk
            try {
                Files.createDirectories(target.getParent());

                try (var out = Files.newOutputStream(temp)) {
                    byte[] buffer = new byte[BUFFER_SIZE];
                    int read;
                    while ((read = readChunk(in, buffer, url, token)) != -1) {
                        token.throwIfCancelled(url);
                        out.write(buffer, 0, read);
                        onBytes.accept(read);
                    }
                }

                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                if (token.isCancelled()) throw new LauncherException(ErrorKind.CANCELLED, url + " was cancelled", e);
                throw new LauncherException(ErrorKind.IO, "Could not write " + target + ": " + e.getMessage(), e);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            if (token.isCancelled()) throw new LauncherException(ErrorKind.CANCELLED, url + " was cancelled", e);
            throw new LauncherException(ErrorKind.NETWORK, "Failed to download " + url + ": " + e.getMessage(), e);
        } catch (LauncherException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    private static int readChunk(InputStream in, byte[] buffer, String url, CancellationToken token) throws LauncherException {
        try {
            return in.read(buffer);
        } catch (IOException e) {
            if (token.isCancelled()) throw new LauncherException(ErrorKind.CANCELLED, url + " was cancelled", e);
            throw new LauncherException(ErrorKind.NETWORK, "Failed to download " + url + ": " + e.getMessage(), e);
        }
    }

    private static LauncherException classify(Throwable cause, String what) {
        while ((cause instanceof CompletionException || cause instanceof UncheckedIOException) && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof LauncherException e) {
            return e;
        } else if (cause instanceof JsonDataException || cause instanceof JsonEncodingException) {
            return new LauncherException(ErrorKind.PARSE, "Invalid JSON from " + what + ": " + cause.getMessage(), cause);
        } else if (cause instanceof StatusCodeException e) {
            return new LauncherException(ErrorKind.NETWORK, e.getMessage(), e);
        } else if (cause instanceof IOException) {
            return new LauncherException(ErrorKind.NETWORK, "Request to " + what + " failed: " + cause, cause);
        }

        return LauncherException.of(cause, what);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.debug("Could not delete partial download {}", path, e);
        }
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static final class StatusCodeException extends IOException {
        private final int statusCode;

        public StatusCodeException(String url, int statusCode) {
            super("HTTP " + statusCode + " for " + url);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }
}
