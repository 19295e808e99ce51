package com.wyzinc.pricewatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wyzinc.pricewatch.domain.ExtractionRule;
import com.wyzinc.pricewatch.domain.LoginSettings;
import com.wyzinc.pricewatch.domain.ProductRule;
import com.wyzinc.pricewatch.domain.WatchConfig;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the YAML watch list and rejects rules that could never be applied.
 */
@Slf4j
public class WatchConfigLoader {
    private final ObjectMapper objectMapper;

    public WatchConfigLoader() {
        this.objectMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public WatchConfig load(Path file) {
        log.debug("Loading watch configuration from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read watch configuration " + file, e);
        }
    }

    public WatchConfig load(InputStream in, String source) {
        WatchConfig config;
        try {
            config = objectMapper.readValue(in, WatchConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid watch configuration " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Watch configuration " + source + " is empty");
        }
        validate(config, source);
        log.info("Loaded {} products from {}", config.getProducts().size(), source);
        return config;
    }

    private void validate(WatchConfig config, String source) {
        LoginSettings login = config.getLogin();
        if (login == null) {
            throw new ConfigurationException("Missing 'login' section in " + source);
        }
        requireSet(login.getLoginPage(), "login.login_page", source);
        requireSet(login.getPostUrl(), "login.post_url", source);
        requireSet(login.getUserField(), "login.user_field", source);
        requireSet(login.getPassField(), "login.pass_field", source);

        Set<String> urls = new HashSet<>();
        for (ProductRule product : config.getProducts()) {
            requireSet(product.getUrl(), "products[].url", source);
            if (!urls.add(product.getUrl())) {
                throw new ConfigurationException("Duplicated product url " + product.getUrl() + " in " + source);
            }
            validateRule(product.getPriceRule(), product.getUrl() + " price");
            validateRule(product.getStockRule(), product.getUrl() + " stock");
        }
    }

    private void validateRule(ExtractionRule rule, String field) {
        if (rule.hasSelector()) {
            try {
                QueryParser.parse(rule.getSelector());
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                throw new ConfigurationException("Invalid selector for " + field + ": " + e.getMessage(), e);
            }
        }
        compile(rule.getSelectorRegex(), field);
        compile(rule.getFallbackRegex(), field);
    }

    private void compile(String regex, String field) {
        if (regex == null || regex.isBlank()) {
            return;
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regex for " + field + ": " + e.getDescription(), e);
        }
    }

    private static void requireSet(String value, String key, String source) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing '" + key + "' in " + source);
        }
    }
}
