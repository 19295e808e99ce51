package com.wyzinc.pricewatch.service;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Hands the message to every sink. A sink that throws does not keep the others from sending.
 */
@Slf4j
public class NotificationService implements NotificationSink {
    private final List<NotificationSink> sinks;

    public NotificationService(List<NotificationSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void send(String message) {
        for (NotificationSink sink : sinks) {
            try {
                sink.send(message);
            } catch (RuntimeException e) {
                log.error("Notification through {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
