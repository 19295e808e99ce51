package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.ChangeEvent;
import com.wyzinc.pricewatch.domain.ProductOutcome;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the single message sent at the end of a run.
 */
public class ReportFormatter {
    private final String supplierName;

    public ReportFormatter(String supplierName) {
        this.supplierName = supplierName;
    }

    public String compose(List<ProductOutcome> outcomes) {
        List<String> blocks = outcomes.stream()
                .filter(ProductOutcome::isNewsworthy)
                .map(this::block)
                .collect(Collectors.toList());
        if (blocks.isEmpty()) {
            return ":white_check_mark: No price/stock changes (" + supplierName + ").";
        }
        return ":bell: **Price/stock changes detected (" + supplierName + ")**\n\n" + String.join("\n\n", blocks);
    }

    public String loginFailed() {
        return ":warning: Login to supplier (" + supplierName + ") failed. Check the credentials.";
    }

    public String stateNotSaved(String reason) {
        return ":warning: Could not save state: " + reason;
    }

    private String block(ProductOutcome outcome) {
        if (outcome.isFailed()) {
            return ":x: Failed to read " + outcome.getName() + ": " + outcome.getError();
        }
        String changes = outcome.getEvents().stream()
                .map(ChangeEvent::describe)
                .collect(Collectors.joining("; "));
        return "**[" + outcome.getName() + "]**\n" + outcome.getUrl() + "\nChanges: " + changes;
    }
}
