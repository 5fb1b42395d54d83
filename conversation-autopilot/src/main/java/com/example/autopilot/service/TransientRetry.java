package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.service.exception.ServiceException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retries calls that fail with a transient {@link ServiceException}, backing off exponentially.
 * Only idempotent operations go through here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransientRetry {

    private final AutopilotProperties properties;

    public <T> T call(String operation, Supplier<T> action) {
        AutopilotProperties.Retry retry = properties.getRetry();
        int maxAttempts = Math.max(retry.getMaxAttempts(), 1);
        Duration backoff = retry.getInitialBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ServiceException ex) {
                if (!ex.isTransient() || attempt >= maxAttempts) {
                    throw ex;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoff.toMillis(), ex.getMessage());
                sleep(backoff, ex);
                backoff = next(backoff, retry);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private Duration next(Duration current, AutopilotProperties.Retry retry) {
        long nextMillis = (long) (current.toMillis() * Math.max(retry.getMultiplier(), 1.0));
        return Duration.ofMillis(Math.min(nextMillis, retry.getMaxBackoff().toMillis()));
    }

    private void sleep(Duration backoff, ServiceException failure) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw failure;
        }
    }
}
