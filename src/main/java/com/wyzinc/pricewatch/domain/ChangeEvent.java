package com.wyzinc.pricewatch.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A difference found between the stored snapshot of a product and the current one.
 */
public interface ChangeEvent {

    String ABSENT = "none";

    Kind getKind();

    /** Human readable form used in notifications. */
    String describe();

    enum Kind {
        NEW_RECORD,
        PRICE_CHANGED,
        STOCK_CHANGED
    }

    static ChangeEvent newRecord() {
        return NewRecord.INSTANCE;
    }

    static ChangeEvent priceChanged(BigDecimal oldPrice, BigDecimal newPrice) {
        return new PriceChanged(oldPrice, newPrice);
    }

    static ChangeEvent stockChanged(String oldStock, String newStock) {
        return new StockChanged(oldStock, newStock);
    }

    @Value
    class NewRecord implements ChangeEvent {
        static final NewRecord INSTANCE = new NewRecord();

        @Override
        public Kind getKind() {
            return Kind.NEW_RECORD;
        }

        @Override
        public String describe() {
            return "new record";
        }
    }

    @Value
    class PriceChanged implements ChangeEvent {
        BigDecimal oldPrice;
        BigDecimal newPrice;

        @Override
        public Kind getKind() {
            return Kind.PRICE_CHANGED;
        }

        @Override
        public String describe() {
            return "price: " + format(oldPrice) + " → " + format(newPrice);
        }

        private static String format(BigDecimal price) {
            return price == null ? ABSENT : price.setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
    }

    @Value
    class StockChanged implements ChangeEvent {
        String oldStock;
        String newStock;

        @Override
        public Kind getKind() {
            return Kind.STOCK_CHANGED;
        }

        @Override
        public String describe() {
            return "stock: " + (oldStock == null ? ABSENT : oldStock) + " → " + (newStock == null ? ABSENT : newStock);
        }
    }
}
