package com.wyzinc.pricewatch.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of one extraction strategy. A strategy either settles the field, with or without a
 * value, or passes so the next strategy gets a chance.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Extraction {
    private static final Extraction ABSENT = new Extraction(true, null);
    private static final Extraction PASS = new Extraction(false, null);

    boolean settled;
    String value;

    public static Extraction found(String value) {
        return value == null || value.isEmpty() ? ABSENT : new Extraction(true, value);
    }

    /** The strategy applied and decided the field has no value. */
    public static Extraction absent() {
        return ABSENT;
    }

    /** The strategy did not apply to this page. */
    public static Extraction pass() {
        return PASS;
    }

    public Optional<String> toOptional() {
        return Optional.ofNullable(value);
    }
}
