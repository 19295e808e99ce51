package com.wyzinc.pricewatch.domain;

import lombok.Value;

import java.util.List;

@Value
public class RunReport {
    AuthStatus authStatus;
    List<ProductOutcome> outcomes;
    String message;

    public long failureCount() {
        return outcomes.stream().filter(ProductOutcome::isFailed).count();
    }

    public long changedCount() {
        return outcomes.stream().filter(ProductOutcome::hasChanges).count();
    }
}
