package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.ExtractionRule;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves one field of a product page: selector first, whole-page regex when no node was selected.
 */
public class FieldExtractor {

    public Optional<String> extract(Document document, String rawHtml, ExtractionRule rule) {
        return strategiesFor(rule).apply(document, rawHtml).toOptional();
    }

    ExtractionStrategy strategiesFor(ExtractionRule rule) {
        List<ExtractionStrategy> strategies = new ArrayList<>();
        if (rule.hasSelector()) {
            strategies.add(new SelectorStrategy(rule.getSelector(), rule.getSelectorRegex()));
        }
        if (rule.hasFallbackRegex()) {
            strategies.add(new DocumentRegexStrategy(rule.getFallbackRegex()));
        }
        return ExtractionStrategy.firstMatch(strategies);
    }
}
