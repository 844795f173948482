package com.mediai.mediai_agents.model.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetryConfigTest {

    @Test
    void shouldGrowDelayExponentially() {
        RetryConfig config = new RetryConfig();

        assertEquals(1000L, config.delayAfterAttempt(0));
        assertEquals(2000L, config.delayAfterAttempt(1));
        assertEquals(4000L, config.delayAfterAttempt(2));
    }

    @Test
    void shouldClampOutOfRangeValues() {
        RetryConfig bounded = new RetryConfig(50, -5, 0).bounded();

        assertEquals(10, bounded.getMaxRetries());
        assertEquals(1000L, bounded.getBackoffMs());
        assertEquals(1.0d, bounded.getBackoffMultiplier());
        assertEquals(1, new RetryConfig(0, 100, 2).bounded().getMaxRetries());
    }

    @Test
    void shouldBindSnakeCaseKeys() {
        RetryConfig config = new ObjectMapper().convertValue(
                Map.of("max_retries", 5, "backoff_ms", 10), RetryConfig.class);

        assertEquals(5, config.getMaxRetries());
        assertEquals(10L, config.getBackoffMs());
        assertEquals(2.0d, config.getBackoffMultiplier());
    }
}
