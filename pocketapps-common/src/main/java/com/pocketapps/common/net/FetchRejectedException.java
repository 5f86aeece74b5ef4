package com.pocketapps.common.net;

import java.io.IOException;

/**
 * A fetch that was refused or failed. The {@link Reason} tells security
 * rejections apart from ordinary network failures.
 */
public class FetchRejectedException extends IOException {

    public enum Reason {
        INVALID_URL,
        INSECURE_SCHEME,
        BLOCKED_ADDRESS,
        DNS_FAILURE,
        REDIRECT,
        HTTP_STATUS,
        BODY_TOO_LARGE,
        TIMEOUT,
        CONNECTION_FAILED
    }

    private final Reason reason;

    public FetchRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FetchRejectedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
