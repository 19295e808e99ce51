package com.wyzinc.pricewatch.service;

import com.wyzinc.pricewatch.config.Credentials;
import com.wyzinc.pricewatch.domain.AuthStatus;
import com.wyzinc.pricewatch.domain.LoginSettings;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs in through the storefront's HTML form. The session cookies end up in the
 * {@link HttpService} cookie jar.
 */
public class LoginService {
    private final HttpService httpService;
    private final Map<String, String> headers;
    private final LoggingService logger;

    public LoginService(HttpService httpService, String userAgent) {
        this.httpService = httpService;
        this.headers = Map.of("User-Agent", userAgent);
        this.logger = new LoggingService(LoginService.class);
    }

    public AuthStatus ensureAuthenticated(LoginSettings login, Credentials credentials, AuthVerifier verifier) {
        try {
            logger.info("Logging in at {}", login.getLoginPage());
            String loginPage = httpService.get(login.getLoginPage(), headers);
            Map<String, String> payload = hiddenInputs(Jsoup.parse(loginPage, login.getLoginPage()));
            payload.put(login.getUserField(), credentials.getUsername());
            payload.put(login.getPassField(), credentials.getPassword());

            logger.debug("Posting login form with fields {}", payload.keySet());
            httpService.postForm(login.getPostUrl(), payload, headers);

            String check = httpService.get(login.getLoginPage(), headers);
            AuthStatus status = verifier.verify(check);
            switch (status) {
                case CONFIRMED:
                    logger.info("Login succeeded");
                    break;
                case UNCONFIRMED:
                    logger.warn("Could not confirm login (pages may still be readable without it)");
                    break;
                default:
                    logger.warn("Login rejected by {}", login.getPostUrl());
            }
            return status;
        } catch (HttpRequestException e) {
            logger.error("Login failed: {}", e.getMessage());
            return AuthStatus.FAILED;
        }
    }

    static Map<String, String> hiddenInputs(Document document) {
        Map<String, String> data = new LinkedHashMap<>();
        for (Element input : document.select("input[type=hidden]")) {
            String name = input.attr("name");
            if (!name.isEmpty()) {
                data.put(name, input.attr("value"));
            }
        }
        return data;
    }
}
