package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.ChangeEvent;
import com.wyzinc.pricewatch.domain.Snapshot;

import java.util.ArrayList;
import java.util.List;

public class ChangeDetector {

    /**
     * Lists what changed between the stored snapshot and the current one.
     *
     * @param previous the stored snapshot, or {@code null} the first time a product is seen
     * @param current  the snapshot taken in this run
     * @return the changes in order: new record alone, or price then stock; empty when nothing changed
     */
    public List<ChangeEvent> detect(Snapshot previous, Snapshot current) {
        if (previous == null) {
            return List.of(ChangeEvent.newRecord());
        }
        List<ChangeEvent> events = new ArrayList<>(2);
        if (!previous.samePriceAs(current)) {
            events.add(ChangeEvent.priceChanged(previous.getPrice(), current.getPrice()));
        }
        if (!previous.sameStockAs(current)) {
            events.add(ChangeEvent.stockChanged(previous.getStock(), current.getStock()));
        }
        return List.copyOf(events);
    }
}
