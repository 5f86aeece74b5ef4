package com.pocketapps.common.net;

import java.time.Duration;

/**
 * Limits applied to every outbound fetch.
 *
 * @param timeout      hard deadline for the whole call (connect, TLS, headers
 *                     and body)
 * @param maxBodyBytes response body cap, enforced on the declared length and on
 *                     the bytes actually read
 * @param policy       SSRF policy
 */
public record FetchSettings(Duration timeout, long maxBodyBytes, SsrfGuard.Policy policy) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final long DEFAULT_MAX_BODY_BYTES = 1024 * 1024;

    public static final FetchSettings DEFAULT = new FetchSettings(
            DEFAULT_TIMEOUT, DEFAULT_MAX_BODY_BYTES, SsrfGuard.Policy.DEFAULT);

    public FetchSettings {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (maxBodyBytes <= 0) {
            maxBodyBytes = DEFAULT_MAX_BODY_BYTES;
        }
        if (policy == null) {
            policy = SsrfGuard.Policy.DEFAULT;
        }
    }

    public FetchSettings withTimeout(Duration timeout) {
        return new FetchSettings(timeout, maxBodyBytes, policy);
    }

    public FetchSettings withMaxBodyBytes(long maxBodyBytes) {
        return new FetchSettings(timeout, maxBodyBytes, policy);
    }

    public FetchSettings withPolicy(SsrfGuard.Policy policy) {
        return new FetchSettings(timeout, maxBodyBytes, policy);
    }
}
