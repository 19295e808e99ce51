package com.wyzinc.pricewatch.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns storefront price text such as {@code "1.234,56 €"} into a number. Comma is the decimal
 * separator and dots are thousands grouping.
 */
public class PriceNormalizer {
    private static final Pattern NOISE = Pattern.compile("[\\p{Sc} \\u00A0]");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    public Optional<BigDecimal> normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        String value = NOISE.matcher(raw).replaceAll("")
                .replace(".", "")
                .replace(',', '.');
        if (!PLAIN_DECIMAL.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(value).setScale(2, RoundingMode.HALF_UP));
    }

    public Optional<BigDecimal> normalize(Optional<String> raw) {
        return raw.flatMap(this::normalize);
    }
}
