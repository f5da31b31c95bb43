package com.shipcheck.service.validator;

import java.time.Duration;

/**
 * HTTP GET capability used by the live validator, so it can be tested
 * without a network.
 *
 * The production implementation is {@link HttpPageFetcher}.
 * Tests replace this with a {@code @MockBean}.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetch a page. Never throws; network failures come back as status -1.
     *
     * @param url     absolute URL of the page
     * @param timeout read timeout for the request
     */
    FetchResult fetch(String url, Duration timeout);
}
