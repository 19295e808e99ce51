package com.wyzinc.pricewatch.service;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.LoadState;
import lombok.extern.slf4j.Slf4j;

import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders product pages in headless Chromium, for storefronts that fill in price and stock with
 * JavaScript. Session cookies from the HTTP login are copied into the browser before each page.
 */
@Slf4j
public class BrowserPageFetcher implements PageFetcher {
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final CookieStore cookieStore;
    private final double timeoutMillis;

    public BrowserPageFetcher(CookieStore cookieStore, String userAgent, Duration timeout) {
        this.cookieStore = cookieStore;
        this.timeoutMillis = timeout.toMillis();
        this.playwright = Playwright.create();
        this.browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
        this.context = browser.newContext(new Browser.NewContextOptions()
                .setLocale("pt-PT")
                .setTimezoneId("Europe/Lisbon")
                .setUserAgent(userAgent)
                .setViewportSize(1920, 1080));
    }

    @Override
    public String fetch(String url) {
        copySessionCookies(url);
        Page page = null;
        try {
            page = context.newPage();
            log.debug("Navigating to URL: {}", url);
            var response = page.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMillis));
            if (response != null && (response.status() < 200 || response.status() >= 300)) {
                throw new HttpRequestException("GET", url, response.status());
            }
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMillis));
            return page.content();
        } catch (PlaywrightException e) {
            throw new HttpRequestException("GET", url, e);
        } finally {
            if (page != null) {
                try {
                    page.close();
                } catch (PlaywrightException e) {
                    log.warn("Error closing browser tab for {}: {}", url, e.getMessage());
                }
            }
        }
    }

    private void copySessionCookies(String url) {
        List<Cookie> cookies = toBrowserCookies(cookieStore.get(URI.create(url)), url);
        if (!cookies.isEmpty()) {
            context.addCookies(cookies);
        }
    }

    static List<Cookie> toBrowserCookies(List<HttpCookie> cookies, String url) {
        return cookies.stream()
                .map(c -> new Cookie(c.getName(), c.getValue()).setUrl(url))
                .collect(Collectors.toList());
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
            playwright.close();
        } catch (PlaywrightException e) {
            log.error("Error closing browser: {}", e.getMessage());
        }
    }
}
