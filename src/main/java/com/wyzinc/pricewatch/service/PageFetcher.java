package com.wyzinc.pricewatch.service;

/**
 * Downloads the HTML of a product page.
 */
public interface PageFetcher extends AutoCloseable {

    /**
     * @throws HttpRequestException when the page cannot be retrieved
     */
    String fetch(String url);

    @Override
    default void close() {
    }
}
