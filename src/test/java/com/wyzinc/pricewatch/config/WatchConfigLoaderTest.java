package com.wyzinc.pricewatch.config;

import static org.assertj.core.api.Assertions.*;

import com.wyzinc.pricewatch.domain.ExtractionRule;
import com.wyzinc.pricewatch.domain.LoginSettings;
import com.wyzinc.pricewatch.domain.ProductRule;
import com.wyzinc.pricewatch.domain.WatchConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class WatchConfigLoaderTest {

    private static final String LOGIN = "login:\n"
            + "  login_page: https://shop.example/login\n"
            + "  post_url: https://shop.example/login/process\n"
            + "  user_field: email\n"
            + "  pass_field: password\n";

    private final WatchConfigLoader loader = new WatchConfigLoader();

    private WatchConfig load(String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
    }

    @Test
    void testLoadsFullConfiguration() throws Exception {
        // Given
        WatchConfig config;
        try (InputStream in = getClass().getResourceAsStream("/config/watch.yaml")) {
            // When
            config = loader.load(in, "watch.yaml");
        }

        // Then
        LoginSettings login = config.getLogin();
        assertThat(login.getLoginPage()).isEqualTo("https://shop.example/login");
        assertThat(login.getUserField()).isEqualTo("email_address");
        assertThat(login.getSuccessMarkers()).isEqualTo(LoginSettings.DEFAULT_SUCCESS_MARKERS);
        assertThat(login.getFailureMarkers()).containsExactly("palavra-passe incorreta");

        assertThat(config.getProducts()).extracting(ProductRule::getUrl)
                .containsExactly("https://shop.example/p/drill", "https://shop.example/p/saw");

        ProductRule drill = config.getProducts().get(0);
        assertThat(drill.getDisplayName()).isEqualTo("Drill");
        assertThat(drill.getPriceRule().getSelector()).isEqualTo(".productPrice");
        assertThat(drill.getPriceRule().getSelectorRegex()).isEqualTo("([\\d\\.]+,\\d{2})");
        assertThat(drill.getPriceRule().getFallbackRegex()).isEqualTo("\"price\":\\s*\"([^\"]+)\"");
        assertThat(drill.getStockRule().getSelector()).isEqualTo(".stock");
        assertThat(drill.getStockRule().hasFallbackRegex()).isFalse();

        ProductRule saw = config.getProducts().get(1);
        assertThat(saw.getDisplayName()).isEqualTo("https://shop.example/p/saw");
        assertThat(saw.getPriceRule().hasSelector()).isFalse();
        assertThat(saw.getStockRule()).isEqualTo(ExtractionRule.empty());
    }

    @Test
    void testLoadsFromFile(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("watch.yaml");
        Files.writeString(file, LOGIN + "products: []\n");

        // When
        WatchConfig config = loader.load(file);

        // Then
        assertThat(config.getProducts()).isEmpty();
    }

    @Test
    void testMissingFileIsConfigurationError(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("absent.yaml");
    }

    @Test
    void testMissingLoginSection() {
        assertThatThrownBy(() -> load("products: []\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("login");
    }

    @Test
    void testProductWithoutUrl() {
        assertThatThrownBy(() -> load(LOGIN + "products:\n  - name: Drill\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("products[].url");
    }

    @Test
    void testDuplicatedUrl() {
        assertThatThrownBy(() -> load(LOGIN + "products:\n  - url: https://a\n  - url: https://a\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicated");
    }

    @Test
    void testInvalidRegex() {
        assertThatThrownBy(() -> load(LOGIN + "products:\n  - url: https://a\n    price:\n      regex: \"([0-9\"\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid regex for https://a price");
    }

    @Test
    void testInvalidSelector() {
        assertThatThrownBy(() -> load(LOGIN + "products:\n  - url: https://a\n    stock:\n      selector: \"div[\"\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid selector for https://a stock");
    }
}
