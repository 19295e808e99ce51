package com.wyzinc.pricewatch.service;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class NotificationServiceTest {

    @Test
    void testFailingSinkDoesNotBlockOthers() {
        // Given
        List<String> delivered = new ArrayList<>();
        NotificationSink broken = message -> {
            throw new IllegalStateException("sink down");
        };
        NotificationService service = new NotificationService(List.of(broken, delivered::add));

        // When/Then
        assertThatCode(() -> service.send("hello")).doesNotThrowAnyException();
        assertThat(delivered).containsExactly("hello");
    }

    @Test
    void testMisconfiguredWebhookStillReachesNextSink() {
        // Given
        List<String> delivered = new ArrayList<>();
        NotificationService service = new NotificationService(List.of(
                new DiscordWebhookNotifier(new HttpService(Duration.ofSeconds(5)), "not a url"),
                delivered::add));

        // When
        service.send("hello");

        // Then
        assertThat(delivered).containsExactly("hello");
    }
}
