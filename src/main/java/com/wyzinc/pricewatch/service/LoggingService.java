package com.wyzinc.pricewatch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Logger that tags everything logged between {@link #startOperation} and {@link #endOperation}
 * with an operation id, and optionally with the product being processed.
 */
public class LoggingService {
    private final Logger logger;

    public LoggingService(Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
    }

    public void startOperation(String operation) {
        MDC.put("operationId", UUID.randomUUID().toString());
        MDC.put("operation", operation);
        debug("Starting operation: {}", operation);
    }

    public void endOperation(String operation) {
        debug("Ending operation: {}", operation);
        MDC.clear();
    }

    public void enterProduct(String url) {
        MDC.put("product", url);
    }

    public void leaveProduct() {
        MDC.remove("product");
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public void error(String message, Object... args) {
        logger.error(message, args);
    }

    public void error(String message, Throwable throwable) {
        logger.error(message, throwable);
    }
}
