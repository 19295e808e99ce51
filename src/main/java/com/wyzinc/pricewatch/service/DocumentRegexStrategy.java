package com.wyzinc.pricewatch.service;

import org.jsoup.nodes.Document;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Searches the raw page source, ignoring case and letting the pattern span lines.
 */
public class DocumentRegexStrategy implements ExtractionStrategy {
    private final Pattern pattern;

    public DocumentRegexStrategy(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    @Override
    public Extraction apply(Document document, String rawHtml) {
        Matcher matcher = pattern.matcher(rawHtml);
        return matcher.find() ? Extraction.found(RegexSupport.firstGroup(matcher)) : Extraction.pass();
    }
}
