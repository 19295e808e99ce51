package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.ProductRule;
import com.wyzinc.pricewatch.domain.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.time.Clock;
import java.util.Optional;

/**
 * Reads price and stock of one product out of its fetched page.
 */
@Slf4j
public class ProductSnapshotter {
    private final FieldExtractor fieldExtractor;
    private final PriceNormalizer priceNormalizer;
    private final Clock clock;

    public ProductSnapshotter(FieldExtractor fieldExtractor, PriceNormalizer priceNormalizer, Clock clock) {
        this.fieldExtractor = fieldExtractor;
        this.priceNormalizer = priceNormalizer;
        this.clock = clock;
    }

    public ProductSnapshotter() {
        this(new FieldExtractor(), new PriceNormalizer(), Clock.systemUTC());
    }

    public Snapshot snapshot(String html, ProductRule product) {
        Document document = Jsoup.parse(html, product.getUrl());

        Optional<String> rawPrice = fieldExtractor.extract(document, html, product.getPriceRule());
        Optional<String> stock = fieldExtractor.extract(document, html, product.getStockRule());

        Snapshot snapshot = Snapshot.builder()
                .url(product.getUrl())
                .name(product.getDisplayName())
                .price(priceNormalizer.normalize(rawPrice).orElse(null))
                .rawPrice(rawPrice.orElse(null))
                .stock(stock.orElse(null))
                .checkedAt(clock.instant())
                .build();

        if (rawPrice.isPresent() && snapshot.getPrice() == null) {
            log.debug("Price text '{}' of {} is not a number", rawPrice.get(), product.getUrl());
        }
        return snapshot;
    }
}
