package com.wyzinc.pricewatch.service;

import org.jsoup.nodes.Document;

import java.util.List;

@FunctionalInterface
public interface ExtractionStrategy {

    Extraction apply(Document document, String rawHtml);

    /**
     * Runs the strategies in order and keeps the first one that settles the field.
     */
    static ExtractionStrategy firstMatch(List<ExtractionStrategy> strategies) {
        return (document, rawHtml) -> {
            for (ExtractionStrategy strategy : strategies) {
                Extraction result = strategy.apply(document, rawHtml);
                if (result.isSettled()) {
                    return result;
                }
            }
            return Extraction.absent();
        };
    }
}
