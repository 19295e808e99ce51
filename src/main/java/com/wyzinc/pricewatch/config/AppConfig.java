package com.wyzinc.pricewatch.config;

import lombok.Getter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Application settings from {@code application.properties}. Every key can be overridden by an
 * environment variable named after it, e.g. {@code price-watch.state-file} by {@code PRICE_WATCH_STATE_FILE}.
 */
@Getter
public class AppConfig {
    private static AppConfig instance;

    private final Path configFile;
    private final Path stateFile;
    private final String supplierName;
    private final String userAgent;
    private final Duration requestDelay;
    private final Duration httpTimeout;
    private final FetcherMode fetcherMode;
    private final UnconfirmedLoginPolicy unconfirmedLoginPolicy;
    private final String usernameEnv;
    private final String passwordEnv;
    private final String discordWebhookUrl;
    private final String vonageApiKey;
    private final String vonageApiSecret;
    private final String smsSender;
    private final List<String> smsRecipients;

    AppConfig(Properties props, Function<String, String> env) {
        Function<String, String> lookup = key -> {
            String override = env.apply(toEnvName(key));
            String value = override != null ? override : props.getProperty(key);
            return value == null ? null : value.trim();
        };

        this.configFile = Path.of(orDefault(lookup.apply("price-watch.config-file"), "config/mauser.yaml"));
        this.stateFile = Path.of(orDefault(lookup.apply("price-watch.state-file"), "data/state.json"));
        this.supplierName = orDefault(lookup.apply("price-watch.supplier-name"), "Mauser");
        this.userAgent = orDefault(lookup.apply("price-watch.user-agent"),
                "Mozilla/5.0 (compatible; WyzincPriceWatcher/1.0; +https://wyzinc.pt)");
        this.requestDelay = Duration.ofMillis(Long.parseLong(orDefault(lookup.apply("price-watch.request-delay-ms"), "1000")));
        this.httpTimeout = Duration.ofSeconds(Long.parseLong(orDefault(lookup.apply("price-watch.http-timeout-seconds"), "60")));
        this.fetcherMode = FetcherMode.valueOf(
                orDefault(lookup.apply("price-watch.fetcher"), "http").toUpperCase(Locale.ROOT));
        this.unconfirmedLoginPolicy = UnconfirmedLoginPolicy.valueOf(
                orDefault(lookup.apply("price-watch.auth.on-unconfirmed"), "continue").toUpperCase(Locale.ROOT));
        this.usernameEnv = orDefault(lookup.apply("price-watch.credentials.username-env"), "MAUSER_USERNAME");
        this.passwordEnv = orDefault(lookup.apply("price-watch.credentials.password-env"), "MAUSER_PASSWORD");
        this.discordWebhookUrl = emptyToNull(lookup.apply("discord.webhook.url"));
        this.vonageApiKey = emptyToNull(lookup.apply("vonage.api.key"));
        this.vonageApiSecret = emptyToNull(lookup.apply("vonage.api.secret"));
        this.smsSender = orDefault(lookup.apply("sms.sender"), "PriceWatch");
        this.smsRecipients = Arrays.stream(orDefault(lookup.apply("sms.recipients"), "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private AppConfig() {
        this(loadProperties(), System::getenv);
    }

    public static AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig();
        }
        return instance;
    }

    public static AppConfig of(Map<String, String> properties) {
        Properties props = new Properties();
        props.putAll(properties);
        return new AppConfig(props, key -> null);
    }

    public boolean isSmsEnabled() {
        return vonageApiKey != null && vonageApiSecret != null && !smsRecipients.isEmpty();
    }

    static String toEnvName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }

    private static Properties loadProperties() {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load application.properties", e);
        }
        return props;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    public enum FetcherMode {
        HTTP,
        BROWSER
    }

    public enum UnconfirmedLoginPolicy {
        CONTINUE,
        ABORT
    }
}
