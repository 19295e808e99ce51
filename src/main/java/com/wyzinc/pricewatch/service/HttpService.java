package com.wyzinc.pricewatch.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Blocking HTTP client sharing one cookie jar across requests, so a login carries over to page fetches.
 */
@Slf4j
public class HttpService {
    private final HttpClient httpClient;
    private final CookieManager cookieManager;
    private final Duration timeout;

    public HttpService(Duration timeout) {
        this(new CookieManager(null, CookiePolicy.ACCEPT_ALL), timeout);
    }

    public HttpService(CookieManager cookieManager, Duration timeout) {
        this.cookieManager = cookieManager;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(cookieManager)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public CookieManager getCookieManager() {
        return cookieManager;
    }

    public String get(String url, Map<String, String> headers) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .GET()
                .uri(URI.create(url))
                .timeout(timeout);
        return send("GET", url, requestBuilder, headers);
    }

    public String postForm(String url, Map<String, String> form, Map<String, String> headers) {
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .uri(URI.create(url))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(timeout);
        return send("POST", url, requestBuilder, headers);
    }

    public String postJson(String url, String json, Map<String, String> headers) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(timeout);
        return send("POST", url, requestBuilder, headers);
    }

    private String send(String method, String url, HttpRequest.Builder requestBuilder, Map<String, String> headers) {
        if (headers != null) {
            headers.forEach(requestBuilder::header);
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Error executing {} request to {}: {}", method, url, e.getMessage());
            throw new HttpRequestException(method, url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpRequestException(method, url, e);
        }

        log.debug("{} request to {} returned status code: {}", method, url, response.statusCode());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new HttpRequestException(method, url, response.statusCode());
        }
        return response.body();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
