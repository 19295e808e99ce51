package com.wyzinc.pricewatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class DiscordWebhookNotifier implements NotificationSink {
    static final int MAX_CONTENT_LENGTH = 2000;
    private static final String TRUNCATED = "\n… (truncated)";

    private final HttpService httpService;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;

    public DiscordWebhookNotifier(HttpService httpService, String webhookUrl) {
        this.httpService = httpService;
        this.objectMapper = new ObjectMapper();
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void send(String message) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("Discord webhook URL not set. Message: {}", message);
            return;
        }
        try {
            String body = objectMapper.writeValueAsString(Map.of("content", fitToLimit(message)));
            httpService.postJson(webhookUrl, body, Map.of());
            log.info("Notification sent to Discord");
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to send notification to Discord: {}", e.getMessage(), e);
        }
    }

    static String fitToLimit(String message) {
        if (message.length() <= MAX_CONTENT_LENGTH) {
            return message;
        }
        int cut = MAX_CONTENT_LENGTH - TRUNCATED.length();
        if (Character.isHighSurrogate(message.charAt(cut - 1))) {
            cut--;
        }
        return message.substring(0, cut) + TRUNCATED;
    }
}
