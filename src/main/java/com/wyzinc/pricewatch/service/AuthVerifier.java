package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.AuthStatus;

/**
 * Decides from the page shown after logging in whether the session is authenticated.
 */
@FunctionalInterface
public interface AuthVerifier {
    AuthStatus verify(String html);
}
