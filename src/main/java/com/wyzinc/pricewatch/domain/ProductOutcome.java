package com.wyzinc.pricewatch.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of processing one product during a run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProductOutcome {
    String name;
    String url;
    List<ChangeEvent> events;
    String error;

    public static ProductOutcome success(ProductRule product, List<ChangeEvent> events) {
        return new ProductOutcome(product.getDisplayName(), product.getUrl(), List.copyOf(events), null);
    }

    public static ProductOutcome failure(ProductRule product, Throwable cause) {
        return new ProductOutcome(product.getDisplayName(), product.getUrl(), List.of(), describe(cause));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean hasChanges() {
        return !events.isEmpty();
    }

    /** Whether this outcome belongs in the notification. */
    public boolean isNewsworthy() {
        return isFailed() || hasChanges();
    }
}
