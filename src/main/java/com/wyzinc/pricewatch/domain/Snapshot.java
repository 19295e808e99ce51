package com.wyzinc.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * What was observed on one product page during one run.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Snapshot {
    String url;
    String name;
    BigDecimal price;

    @JsonProperty("raw_price")
    String rawPrice;

    String stock;

    @JsonProperty("checked_at")
    Instant checkedAt;

    public boolean samePriceAs(Snapshot other) {
        if (price == null || other.price == null) {
            return price == other.price;
        }
        return price.compareTo(other.price) == 0;
    }

    public boolean sameStockAs(Snapshot other) {
        return Objects.equals(stock, other.stock);
    }
}
