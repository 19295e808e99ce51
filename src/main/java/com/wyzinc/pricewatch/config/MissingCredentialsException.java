package com.wyzinc.pricewatch.config;

public class MissingCredentialsException extends RuntimeException {
    public MissingCredentialsException(String usernameEnv, String passwordEnv) {
        super("Set " + usernameEnv + " and " + passwordEnv + " in the environment before running.");
    }
}
