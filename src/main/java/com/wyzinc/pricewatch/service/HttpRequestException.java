package com.wyzinc.pricewatch.service;

import lombok.Getter;

/**
 * A request that could not be sent or that came back with a non-2xx status.
 */
@Getter
public class HttpRequestException extends RuntimeException {
    /** Response status, or -1 when no response was received. */
    private final int statusCode;

    public HttpRequestException(String method, String url, int statusCode) {
        super(method + " " + url + " returned HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public HttpRequestException(String method, String url, Throwable cause) {
        super(method + " " + url + " failed: " + cause.getMessage(), cause);
        this.statusCode = -1;
    }
}
