package com.pocketapps.common.net;

/**
 * Body of a successful guarded fetch.
 */
public record FetchedBody(int statusCode, String body, String contentType, long byteCount) {
}
