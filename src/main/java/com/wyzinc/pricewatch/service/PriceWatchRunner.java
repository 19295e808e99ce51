package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.config.AppConfig.UnconfirmedLoginPolicy;
import com.wyzinc.pricewatch.domain.AuthStatus;
import com.wyzinc.pricewatch.domain.ChangeEvent;
import com.wyzinc.pricewatch.domain.ProductOutcome;
import com.wyzinc.pricewatch.domain.ProductRule;
import com.wyzinc.pricewatch.domain.RunReport;
import com.wyzinc.pricewatch.domain.Snapshot;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One pass over the watch list: log in, read every product in order, compare with the stored
 * state, save the state once and send one message.
 */
@Builder
public class PriceWatchRunner {
    private static final LoggingService logger = new LoggingService(PriceWatchRunner.class);

    @Singular
    private final List<ProductRule> products;
    @NonNull
    private final Authenticator authenticator;
    @NonNull
    private final PageFetcher fetcher;
    @NonNull
    private final StateStore stateStore;
    @NonNull
    private final NotificationSink notifier;
    @NonNull
    private final ReportFormatter formatter;
    @Builder.Default
    private final ProductSnapshotter snapshotter = new ProductSnapshotter();
    @Builder.Default
    private final ChangeDetector changeDetector = new ChangeDetector();
    @Builder.Default
    private final UnconfirmedLoginPolicy unconfirmedLoginPolicy = UnconfirmedLoginPolicy.CONTINUE;
    @Builder.Default
    private final Duration requestDelay = Duration.ofSeconds(1);
    @Builder.Default
    private final Sleeper sleeper = Sleeper.THREAD;

    public RunReport run() {
        try {
            logger.startOperation("priceWatchRun");

            AuthStatus authStatus = authenticator.authenticate();
            if (!mayProceed(authStatus)) {
                logger.error("Stopping run: login status {}", authStatus);
                String message = formatter.loginFailed();
                notifier.send(message);
                return new RunReport(authStatus, List.of(), message);
            }

            List<ProductOutcome> outcomes = new ArrayList<>(products.size());
            for (int i = 0; i < products.size(); i++) {
                if (i > 0) {
                    pause();
                }
                outcomes.add(process(products.get(i)));
            }

            String message = formatter.compose(outcomes);
            try {
                stateStore.save();
            } catch (UncheckedIOException e) {
                logger.error("Failed to save state", e);
                message = message + "\n\n" + formatter.stateNotSaved(e.getMessage());
            }

            RunReport report = new RunReport(authStatus, List.copyOf(outcomes), message);
            logger.info("Run finished: {} products, {} changed, {} failed",
                    outcomes.size(), report.changedCount(), report.failureCount());
            notifier.send(message);
            return report;
        } finally {
            logger.endOperation("priceWatchRun");
        }
    }

    private boolean mayProceed(AuthStatus status) {
        switch (status) {
            case CONFIRMED:
                return true;
            case UNCONFIRMED:
                return unconfirmedLoginPolicy == UnconfirmedLoginPolicy.CONTINUE;
            default:
                return false;
        }
    }

    ProductOutcome process(ProductRule product) {
        String url = product.getUrl();
        logger.enterProduct(url);
        try {
            String html = fetcher.fetch(url);
            Snapshot current = snapshotter.snapshot(html, product);
            Snapshot previous = stateStore.get(url).orElse(null);
            List<ChangeEvent> events = changeDetector.detect(previous, current);
            stateStore.put(current);

            logger.info("Processed {}: price={} stock={} changes={}",
                    product.getDisplayName(), current.getPrice(), current.getStock(), events.size());
            return ProductOutcome.success(product, events);
        } catch (Throwable e) {
            logger.error("Error reading {}: {}", product.getDisplayName(), String.valueOf(e));
            return ProductOutcome.failure(product, e);
        } finally {
            logger.leaveProduct();
        }
    }

    private void pause() {
        try {
            sleeper.sleep(requestDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting between requests");
        }
    }
}
