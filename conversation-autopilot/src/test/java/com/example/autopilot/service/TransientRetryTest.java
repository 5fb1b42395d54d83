package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.service.exception.ConversationStoreException;
import com.example.autopilot.service.exception.ServiceException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class TransientRetryTest {

    private TransientRetry retry;

    @BeforeEach
    void setUp() {
        AutopilotProperties properties = new AutopilotProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialBackoff(Duration.ZERO);
        retry = new TransientRetry(properties);
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("lookup", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ConversationStoreException("down", null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("save", () -> {
            calls.incrementAndGet();
            throw new ConversationStoreException("down", null);
        })).isInstanceOf(ConversationStoreException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("save", () -> {
            calls.incrementAndGet();
            throw new ServiceException(HttpStatus.BAD_REQUEST, "bad input");
        })).isInstanceOf(ServiceException.class);
        assertThat(calls).hasValue(1);
    }
}
