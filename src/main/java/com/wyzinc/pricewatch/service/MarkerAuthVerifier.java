package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.AuthStatus;
import com.wyzinc.pricewatch.domain.LoginSettings;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Looks for known phrases in the page: a failure phrase wins over a success phrase, and a page
 * with neither is unconfirmed.
 */
public class MarkerAuthVerifier implements AuthVerifier {
    private final List<String> successMarkers;
    private final List<String> failureMarkers;

    public MarkerAuthVerifier(List<String> successMarkers, List<String> failureMarkers) {
        this.successMarkers = lowerCase(successMarkers);
        this.failureMarkers = lowerCase(failureMarkers);
    }

    public static MarkerAuthVerifier from(LoginSettings login) {
        return new MarkerAuthVerifier(login.getSuccessMarkers(), login.getFailureMarkers());
    }

    @Override
    public AuthStatus verify(String html) {
        if (html == null) {
            return AuthStatus.UNCONFIRMED;
        }
        String page = html.toLowerCase(Locale.ROOT);
        if (failureMarkers.stream().anyMatch(page::contains)) {
            return AuthStatus.FAILED;
        }
        if (successMarkers.stream().anyMatch(page::contains)) {
            return AuthStatus.CONFIRMED;
        }
        return AuthStatus.UNCONFIRMED;
    }

    private static List<String> lowerCase(List<String> markers) {
        return markers.stream()
                .filter(m -> m != null && !m.isBlank())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }
}
