package com.wyzinc.pricewatch.service;

/**
 * Delivers the end-of-run message. Implementations log delivery problems instead of throwing.
 */
public interface NotificationSink {
    void send(String message);
}
