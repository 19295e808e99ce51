package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.domain.Snapshot;

import java.util.Optional;

/**
 * Last known snapshot per product url.
 */
public interface StateStore {

    Optional<Snapshot> get(String url);

    /** Replaces whatever was stored for the snapshot's url. */
    void put(Snapshot snapshot);

    void save();
}
