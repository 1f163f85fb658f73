package com.phillippitts.livefacts.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Raw output of a content generation call.
 *
 * @param text      generated text, structured or free-form (must not be null)
 * @param companion optional coordinate of the described place, used for a navigation aid
 */
public record ContentResult(String text, Coordinates companion) {

    public ContentResult {
        Objects.requireNonNull(text, "Generated text must not be null");
    }

    public static ContentResult of(String text) {
        return new ContentResult(text, null);
    }

    public Optional<Coordinates> companionCoordinates() {
        return Optional.ofNullable(companion);
    }
}
