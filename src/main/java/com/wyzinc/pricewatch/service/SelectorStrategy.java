package com.wyzinc.pricewatch.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Takes the text of the first node matching a CSS selector, optionally narrowed by a regex.
 * Once a node is found the field is settled: a regex that does not match means no value.
 */
@Slf4j
public class SelectorStrategy implements ExtractionStrategy {
    private final String selector;
    private final Pattern pattern;

    public SelectorStrategy(String selector, String regex) {
        this.selector = selector;
        this.pattern = regex == null || regex.isBlank() ? null : Pattern.compile(regex);
    }

    @Override
    public Extraction apply(Document document, String rawHtml) {
        Element element = document.selectFirst(selector);
        if (element == null) {
            log.debug("No node for selector '{}'", selector);
            return Extraction.pass();
        }
        String text = element.text().trim();
        if (pattern == null) {
            return Extraction.found(text);
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            log.debug("Selector '{}' text '{}' does not match {}", selector, text, pattern);
            return Extraction.absent();
        }
        return Extraction.found(RegexSupport.firstGroup(matcher));
    }
}
