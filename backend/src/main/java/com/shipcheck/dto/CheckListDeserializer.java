package com.shipcheck.dto;

import io.micronaut.core.type.Argument;
import io.micronaut.serde.Decoder;
import io.micronaut.serde.Deserializer;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code checks} as either a JSON array of strings or a bare string.
 * Clients commonly send a single check unwrapped; it becomes a one-element list.
 */
@Singleton
public class CheckListDeserializer implements Deserializer<List<String>> {

    private static final Logger log = LoggerFactory.getLogger(CheckListDeserializer.class);

    @Override
    public List<String> deserialize(Decoder decoder, DecoderContext context,
                                    Argument<? super List<String>> type) throws IOException {
        Object value = decoder.decodeArbitrary();
        if (value instanceof String single) {
            log.warn("checks sent as a single string, wrapping it in a list: '{}'", single);
            return List.of(single);
        }
        if (value instanceof List<?> items) {
            List<String> checks = new ArrayList<>(items.size());
            for (Object item : items) {
                if (!(item instanceof String check)) {
                    throw decoder.createDeserializationException("checks must contain only strings", item);
                }
                checks.add(check);
            }
            return checks;
        }
        throw decoder.createDeserializationException("checks must be a string or a list of strings", value);
    }
}
