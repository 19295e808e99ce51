package com.wyzinc.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * How a single field is located in a product page. Any of the three parts may be absent.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionRule {
    private static final ExtractionRule EMPTY = ExtractionRule.builder().build();

    /** CSS selector of the node holding the value. */
    String selector;

    /** Pattern searched in the selected node's text; group 1 is the value. */
    @JsonProperty("regex")
    String selectorRegex;

    /** Pattern searched in the whole raw page when no node was selected. */
    @JsonProperty("regex_full_html")
    String fallbackRegex;

    public static ExtractionRule empty() {
        return EMPTY;
    }

    public boolean hasSelector() {
        return isSet(selector);
    }

    public boolean hasSelectorRegex() {
        return isSet(selectorRegex);
    }

    public boolean hasFallbackRegex() {
        return isSet(fallbackRegex);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
