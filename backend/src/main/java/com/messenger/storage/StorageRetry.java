package com.messenger.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.messenger.config.MessengerProperties;

import reactor.util.retry.Retry;

/**
 * Builds the bounded-backoff retry used around each individual storage step.
 * Only transient failures are retried; everything else propagates immediately.
 */
@Component
public class StorageRetry {

    private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);

    private final MessengerProperties.Retry settings;

    public StorageRetry(MessengerProperties properties) {
        this.settings = properties.getRetry();
    }

    public Retry transientFailures(String step) {
        return Retry.backoff(settings.getMaxRetries(), settings.getMinBackoff())
                .maxBackoff(settings.getMaxBackoff())
                .filter(StorageRetry::isTransient)
                .doBeforeRetry(signal -> log.debug("Retrying {} (attempt {}): {}",
                        step, signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof TransientStorageException
                || error instanceof TransientDataAccessException
                || error instanceof DriverTimeoutException
                || error instanceof AllNodesFailedException;
    }
}
