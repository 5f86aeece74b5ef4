package com.pocketapps.common.net;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTPS GET hardened against SSRF.
 * <p>
 * The target hostname is checked, resolved at fetch time, and every resolved
 * address is checked again. The connection then goes to that pinned address
 * through a per-call {@link Dns} override, so the transport never performs a
 * second lookup. OkHttp still uses the original hostname for SNI, certificate
 * validation and the {@code Host} header. Redirects are never followed and the
 * body is capped while it streams. The lookup counts against the same
 * deadline as the HTTP call.
 */
@Slf4j
public class SafeFetcher implements UrlFetcher {

    private static final long READ_CHUNK_BYTES = 8192;
    private static final String USER_AGENT = "PocketApps-Automation/1.0";

    private static final ExecutorService LOOKUPS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fetch-dns");
        t.setDaemon(true);
        return t;
    });

    private final OkHttpClient baseClient;
    private final Dns resolver;
    private final FetchSettings settings;

    public SafeFetcher(FetchSettings settings) {
        this(settings, new OkHttpClient(), Dns.SYSTEM);
    }

    public SafeFetcher(FetchSettings settings, OkHttpClient baseClient, Dns resolver) {
        this.settings = settings != null ? settings : FetchSettings.DEFAULT;
        this.resolver = resolver;
        this.baseClient = baseClient.newBuilder()
                .followRedirects(false)
                .followSslRedirects(false)
                .retryOnConnectionFailure(false)
                .proxy(Proxy.NO_PROXY)
                .callTimeout(this.settings.timeout())
                .build();
    }

    public FetchSettings getSettings() {
        return settings;
    }

    @Override
    public FetchedBody fetch(String url) throws FetchRejectedException {
        HttpUrl target = parseHttpsUrl(url);
        String host = target.host();

        long started = System.nanoTime();
        InetAddress pinned = resolveWithinDeadline(host);
        Duration remaining = settings.timeout().minusNanos(System.nanoTime() - started);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new FetchRejectedException(FetchRejectedException.Reason.TIMEOUT,
                    "Timed out after " + settings.timeout().toMillis() + "ms");
        }

        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(remaining)
                .dns(hostname -> {
                    if (!hostname.equalsIgnoreCase(host)) {
                        throw new UnknownHostException("Unexpected lookup for " + hostname);
                    }
                    return List.of(pinned);
                })
                .build();

        Request request = new Request.Builder()
                .url(target)
                .get()
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json, text/plain, */*")
                .build();

        log.debug("Fetching {} via pinned address {}", target.redact(), pinned.getHostAddress());
        try (Response response = client.newCall(request).execute()) {
            int code = response.code();
            if (code >= 300 && code < 400) {
                throw new FetchRejectedException(FetchRejectedException.Reason.REDIRECT,
                        "Redirect " + code + " not followed");
            }
            if (!response.isSuccessful()) {
                throw new FetchRejectedException(FetchRejectedException.Reason.HTTP_STATUS,
                        "Unexpected status " + code);
            }
            return readCapped(code, response.body());
        } catch (FetchRejectedException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new FetchRejectedException(FetchRejectedException.Reason.TIMEOUT,
                    "Timed out after " + settings.timeout().toMillis() + "ms", e);
        } catch (IOException e) {
            throw new FetchRejectedException(FetchRejectedException.Reason.CONNECTION_FAILED,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private InetAddress resolveWithinDeadline(String host) throws FetchRejectedException {
        CompletableFuture<InetAddress> lookup = CompletableFuture.supplyAsync(() -> {
            try {
                return SsrfGuard.resolvePinned(host, settings.policy(), resolver);
            } catch (UnknownHostException e) {
                throw new CompletionException(e);
            }
        }, LOOKUPS);
        try {
            return lookup.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new FetchRejectedException(FetchRejectedException.Reason.TIMEOUT,
                    "Resolving " + host + " took longer than " + settings.timeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchRejectedException(FetchRejectedException.Reason.TIMEOUT,
                    "Interrupted while resolving " + host, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SsrfGuard.SsrfBlockedError) {
                throw new FetchRejectedException(FetchRejectedException.Reason.BLOCKED_ADDRESS, cause.getMessage());
            }
            if (cause instanceof UnknownHostException) {
                throw new FetchRejectedException(FetchRejectedException.Reason.DNS_FAILURE,
                        "Unable to resolve hostname: " + host, cause);
            }
            throw new FetchRejectedException(FetchRejectedException.Reason.DNS_FAILURE,
                    "Lookup of " + host + " failed: " + cause, cause);
        }
    }

    private HttpUrl parseHttpsUrl(String url) throws FetchRejectedException {
        if (url == null || url.isBlank()) {
            throw new FetchRejectedException(FetchRejectedException.Reason.INVALID_URL, "URL is empty");
        }
        String scheme;
        try {
            scheme = new URI(url.trim()).getScheme();
        } catch (URISyntaxException e) {
            throw new FetchRejectedException(FetchRejectedException.Reason.INVALID_URL, "Invalid URL", e);
        }
        if (scheme == null || !scheme.equalsIgnoreCase("https")) {
            throw new FetchRejectedException(FetchRejectedException.Reason.INSECURE_SCHEME,
                    "Only https URLs are allowed");
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null || parsed.host().isEmpty()) {
            throw new FetchRejectedException(FetchRejectedException.Reason.INVALID_URL, "Invalid URL");
        }
        return parsed;
    }

    private FetchedBody readCapped(int code, ResponseBody body) throws IOException {
        if (body == null) {
            return new FetchedBody(code, "", null, 0);
        }
        long limit = settings.maxBodyBytes();
        long declared = body.contentLength();
        if (declared > limit) {
            throw new FetchRejectedException(FetchRejectedException.Reason.BODY_TOO_LARGE,
                    "Declared Content-Length " + declared + " exceeds " + limit + " bytes");
        }

        BufferedSource source = body.source();
        Buffer buffer = new Buffer();
        long total = 0;
        long read;
        while ((read = source.read(buffer, READ_CHUNK_BYTES)) != -1) {
            total += read;
            if (total > limit) {
                throw new FetchRejectedException(FetchRejectedException.Reason.BODY_TOO_LARGE,
                        "Body exceeded " + limit + " bytes while streaming");
            }
        }

        MediaType mediaType = body.contentType();
        Charset charset = mediaType != null ? mediaType.charset(StandardCharsets.UTF_8) : StandardCharsets.UTF_8;
        return new FetchedBody(code, buffer.readString(charset),
                mediaType != null ? mediaType.toString() : null, total);
    }
}
