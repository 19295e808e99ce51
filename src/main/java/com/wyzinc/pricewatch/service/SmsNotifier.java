package com.wyzinc.pricewatch.service;

import com.vonage.client.VonageClient;
import com.vonage.client.sms.MessageStatus;
import com.vonage.client.sms.SmsSubmissionResponse;
import com.vonage.client.sms.messages.TextMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Sends the message as an SMS through Vonage to every configured recipient.
 */
@Slf4j
public class SmsNotifier implements NotificationSink {
    private final Gateway gateway;
    private final String sender;
    private final List<String> recipients;

    public SmsNotifier(String apiKey, String apiSecret, String sender, List<String> recipients) {
        this(vonage(VonageClient.builder().apiKey(apiKey).apiSecret(apiSecret).build()), sender, recipients);
    }

    SmsNotifier(Gateway gateway, String sender, List<String> recipients) {
        this.gateway = gateway;
        this.sender = sender;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public void send(String message) {
        for (String recipient : recipients) {
            try {
                if (gateway.submit(sender, recipient, message)) {
                    log.info("SMS sent to {}", recipient);
                }
            } catch (RuntimeException e) {
                log.error("Failed to send SMS to {}: {}", recipient, e.getMessage(), e);
            }
        }
    }

    static Gateway vonage(VonageClient client) {
        return (from, to, text) -> {
            SmsSubmissionResponse response = client.getSmsClient().submitMessage(new TextMessage(from, to, text, true));
            boolean delivered = response.getMessages().stream()
                    .allMatch(m -> m.getStatus() == MessageStatus.OK);
            if (!delivered) {
                log.error("SMS to {} was rejected: {}", to, response.getMessages());
            }
            return delivered;
        };
    }

    /** Submits one SMS; false when the provider accepted the call but rejected the message. */
    @FunctionalInterface
    interface Gateway {
        boolean submit(String from, String to, String text);
    }
}
