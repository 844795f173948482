package com.mediai.mediai_agents.model.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection retry policy of the ingestor. Can be overridden per call through the
 * {@code retry} key of the ingestion context:
 *
 * <pre>
 * {
 *   "retry": {
 *     "max_retries": 3,
 *     "backoff_ms": 1000,
 *     "backoff_multiplier": 2.0
 *   }
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryConfig {

    /**
     * Total connection attempts, first one included. Clamped to [1, 10].
     */
    @JsonProperty("max_retries")
    private int maxRetries = 3;

    /**
     * Wait before the second attempt.
     */
    @JsonProperty("backoff_ms")
    private long backoffMs = 1000L;

    /**
     * Growth of the wait per failed attempt. 1000ms with 2.0 gives 1s, 2s, 4s...
     */
    @JsonProperty("backoff_multiplier")
    private double backoffMultiplier = 2.0d;

    /** Copy with out-of-range values replaced so bad config cannot stall or skip the connect loop. */
    public RetryConfig bounded() {
        return new RetryConfig(
                Math.max(1, Math.min(10, maxRetries)),
                backoffMs > 0 ? backoffMs : 1000L,
                backoffMultiplier > 0 ? backoffMultiplier : 1.0d);
    }

    /** Wait after the failed attempt with the given zero-based index. */
    public long delayAfterAttempt(int attemptIndex) {
        return (long) (backoffMs * Math.pow(backoffMultiplier, attemptIndex));
    }
}
