package com.wyzinc.pricewatch.service;

import java.util.Map;

public class HttpPageFetcher implements PageFetcher {
    private final HttpService httpService;
    private final Map<String, String> headers;

    public HttpPageFetcher(HttpService httpService, String userAgent) {
        this.httpService = httpService;
        this.headers = Map.of("User-Agent", userAgent);
    }

    @Override
    public String fetch(String url) {
        return httpService.get(url, headers);
    }
}
