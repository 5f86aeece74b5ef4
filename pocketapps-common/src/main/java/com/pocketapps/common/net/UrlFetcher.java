package com.pocketapps.common.net;

/**
 * Performs a single outbound GET.
 */
@FunctionalInterface
public interface UrlFetcher {

    FetchedBody fetch(String url) throws FetchRejectedException;
}
