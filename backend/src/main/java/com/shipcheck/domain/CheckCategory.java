package com.shipcheck.domain;

/**
 * Closed set of verifiable check categories assigned by the check matcher.
 * {@link #GENERIC} is the fallback so classification is always total.
 */
public enum CheckCategory {
    MIT_LICENSE,
    README_QUALITY,
    HTML_ELEMENT_BY_ID,
    CDN_SCRIPT_PRESENCE,
    ARITHMETIC_OPERATIONS,
    GENERIC;

    /** Categories that can still be verified against a fetched live page. */
    public boolean isLiveObservable() {
        return this == HTML_ELEMENT_BY_ID || this == CDN_SCRIPT_PRESENCE;
    }
}
