package com.wyzinc.pricewatch.service;

import static org.assertj.core.api.Assertions.*;

import com.wyzinc.pricewatch.domain.ChangeEvent;
import com.wyzinc.pricewatch.domain.Snapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector();

    private static Snapshot snapshot(String price, String stock) {
        return Snapshot.builder()
                .url("https://shop.example/p/1")
                .name("Drill")
                .price(price == null ? null : new BigDecimal(price))
                .rawPrice(price)
                .stock(stock)
                .checkedAt(Instant.parse("2026-10-19T08:00:00Z"))
                .build();
    }

    @Test
    void testFirstSightingIsOnlyNewRecord() {
        // When
        List<ChangeEvent> events = detector.detect(null, snapshot("10.00", "Em stock"));

        // Then
        assertThat(events).containsExactly(ChangeEvent.newRecord());
    }

    @Test
    void testFirstSightingWithoutValuesIsStillNewRecord() {
        assertThat(detector.detect(null, snapshot(null, null)))
                .extracting(ChangeEvent::getKind)
                .containsExactly(ChangeEvent.Kind.NEW_RECORD);
    }

    @Test
    void testIdenticalSnapshotHasNoChanges() {
        // Given
        Snapshot s = snapshot("10.00", "Em stock");

        // When/Then
        assertThat(detector.detect(s, s)).isEmpty();
        assertThat(detector.detect(snapshot(null, null), snapshot(null, null))).isEmpty();
    }

    @Test
    void testPriceChangeOnly() {
        // When
        List<ChangeEvent> events = detector.detect(snapshot("49.90", "Em stock"), snapshot("54.90", "Em stock"));

        // Then
        assertThat(events).containsExactly(
                ChangeEvent.priceChanged(new BigDecimal("49.90"), new BigDecimal("54.90")));
    }

    @Test
    void testPriceScaleDoesNotCountAsChange() {
        assertThat(detector.detect(snapshot("49.9", null), snapshot("49.90", null))).isEmpty();
    }

    @Test
    void testPriceAndStockChangeInOrder() {
        // When
        List<ChangeEvent> events = detector.detect(snapshot("10.00", "Em stock"), snapshot(null, "Esgotado"));

        // Then
        assertThat(events).containsExactly(
                ChangeEvent.priceChanged(new BigDecimal("10.00"), null),
                ChangeEvent.stockChanged("Em stock", "Esgotado"));
    }

    @Test
    void testStockAppearing() {
        assertThat(detector.detect(snapshot("1.00", null), snapshot("1.00", "Em stock")))
                .containsExactly(ChangeEvent.stockChanged(null, "Em stock"));
    }

    @Test
    void testDescribe() {
        assertThat(ChangeEvent.newRecord().describe()).isEqualTo("new record");
        assertThat(ChangeEvent.priceChanged(new BigDecimal("49.9"), new BigDecimal("54.90")).describe())
                .isEqualTo("price: 49.90 → 54.90");
        assertThat(ChangeEvent.stockChanged(null, "Esgotado").describe())
                .isEqualTo("stock: none → Esgotado");
    }
}
