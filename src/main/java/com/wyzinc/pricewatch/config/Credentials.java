package com.wyzinc.pricewatch.config;

import lombok.ToString;
import lombok.Value;

import java.util.function.Function;

@Value
public class Credentials {
    String username;

    @ToString.Exclude
    String password;

    /**
     * Reads both secrets from the environment.
     *
     * @throws MissingCredentialsException if either is absent or blank
     */
    public static Credentials fromEnvironment(AppConfig config, Function<String, String> env) {
        String username = env.apply(config.getUsernameEnv());
        String password = env.apply(config.getPasswordEnv());
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new MissingCredentialsException(config.getUsernameEnv(), config.getPasswordEnv());
        }
        return new Credentials(username, password);
    }
}
