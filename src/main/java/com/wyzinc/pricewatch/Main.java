package com.wyzinc.pricewatch;

import com.wyzinc.pricewatch.config.AppConfig;
import com.wyzinc.pricewatch.config.Credentials;
import com.wyzinc.pricewatch.config.WatchConfigLoader;
import com.wyzinc.pricewatch.domain.RunReport;
import com.wyzinc.pricewatch.domain.WatchConfig;
import com.wyzinc.pricewatch.service.BrowserPageFetcher;
import com.wyzinc.pricewatch.service.DiscordWebhookNotifier;
import com.wyzinc.pricewatch.service.HttpPageFetcher;
import com.wyzinc.pricewatch.service.HttpService;
import com.wyzinc.pricewatch.service.JsonStateStore;
import com.wyzinc.pricewatch.service.LoginService;
import com.wyzinc.pricewatch.service.MarkerAuthVerifier;
import com.wyzinc.pricewatch.service.NotificationService;
import com.wyzinc.pricewatch.service.NotificationSink;
import com.wyzinc.pricewatch.service.PageFetcher;
import com.wyzinc.pricewatch.service.PriceWatchRunner;
import com.wyzinc.pricewatch.service.ReportFormatter;
import com.wyzinc.pricewatch.service.SmsNotifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class Main {
    public static void main(String[] args) {
        AppConfig config = AppConfig.getInstance();
        Credentials credentials = Credentials.fromEnvironment(config, System::getenv);

        WatchConfig watchConfig = new WatchConfigLoader().load(config.getConfigFile());
        JsonStateStore stateStore = JsonStateStore.load(config.getStateFile());

        HttpService httpService = new HttpService(config.getHttpTimeout());
        LoginService loginService = new LoginService(httpService, config.getUserAgent());
        MarkerAuthVerifier verifier = MarkerAuthVerifier.from(watchConfig.getLogin());

        try (PageFetcher fetcher = createFetcher(config, httpService)) {
            PriceWatchRunner runner = PriceWatchRunner.builder()
                    .products(watchConfig.getProducts())
                    .authenticator(() -> loginService.ensureAuthenticated(watchConfig.getLogin(), credentials, verifier))
                    .fetcher(fetcher)
                    .stateStore(stateStore)
                    .notifier(new NotificationService(createSinks(config, httpService)))
                    .formatter(new ReportFormatter(config.getSupplierName()))
                    .unconfirmedLoginPolicy(config.getUnconfirmedLoginPolicy())
                    .requestDelay(config.getRequestDelay())
                    .build();

            RunReport report = runner.run();
            log.info("Login {}, {} products checked", report.getAuthStatus(), report.getOutcomes().size());
        }
    }

    private static PageFetcher createFetcher(AppConfig config, HttpService httpService) {
        if (config.getFetcherMode() == AppConfig.FetcherMode.BROWSER) {
            return new BrowserPageFetcher(httpService.getCookieManager().getCookieStore(),
                    config.getUserAgent(), config.getHttpTimeout());
        }
        return new HttpPageFetcher(httpService, config.getUserAgent());
    }

    private static List<NotificationSink> createSinks(AppConfig config, HttpService httpService) {
        List<NotificationSink> sinks = new ArrayList<>();
        sinks.add(new DiscordWebhookNotifier(httpService, config.getDiscordWebhookUrl()));
        if (config.isSmsEnabled()) {
            sinks.add(new SmsNotifier(config.getVonageApiKey(), config.getVonageApiSecret(),
                    config.getSmsSender(), config.getSmsRecipients()));
        }
        return sinks;
    }
}
