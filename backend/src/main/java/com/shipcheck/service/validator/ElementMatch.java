package com.shipcheck.service.validator;

import java.util.Optional;

public record ElementMatch(boolean found, Optional<String> tagName) {

    static ElementMatch none() {
        return new ElementMatch(false, Optional.empty());
    }

    static ElementMatch of(String tagName) {
        return new ElementMatch(true, Optional.of(tagName));
    }
}
