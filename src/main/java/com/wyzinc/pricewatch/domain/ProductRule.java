package com.wyzinc.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One watched product page. The url doubles as the key in the state store.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductRule {
    String url;
    String name;

    @JsonProperty("price")
    ExtractionRule priceRule;

    @JsonProperty("stock")
    ExtractionRule stockRule;

    public String getDisplayName() {
        return name == null || name.isBlank() ? url : name;
    }

    public ExtractionRule getPriceRule() {
        return priceRule == null ? ExtractionRule.empty() : priceRule;
    }

    public ExtractionRule getStockRule() {
        return stockRule == null ? ExtractionRule.empty() : stockRule;
    }
}
