package com.wyzinc.pricewatch.domain;

public enum AuthStatus {
    CONFIRMED,
    UNCONFIRMED,
    FAILED
}
