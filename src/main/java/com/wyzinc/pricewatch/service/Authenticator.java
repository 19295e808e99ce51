package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.AuthStatus;

@FunctionalInterface
public interface Authenticator {
    AuthStatus authenticate();
}
