package com.wyzinc.pricewatch.service;

import java.util.regex.Matcher;

final class RegexSupport {
    private RegexSupport() {
    }

    /** Group 1 when the pattern declares one, the whole match otherwise. */
    static String firstGroup(Matcher matcher) {
        return matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
    }
}
