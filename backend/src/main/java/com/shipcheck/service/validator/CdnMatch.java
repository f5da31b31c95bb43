package com.shipcheck.service.validator;

import java.util.Optional;

/**
 * Outcome of a CDN reference scan.
 *
 * @param found          a CDN URL for the library satisfied the request
 * @param url            the URL that matched, or the closest candidate when the version did not
 * @param matchedVersion version parsed from that URL, if any
 */
public record CdnMatch(boolean found, Optional<String> url, Optional<String> matchedVersion) {

    static CdnMatch none() {
        return new CdnMatch(false, Optional.empty(), Optional.empty());
    }
}
