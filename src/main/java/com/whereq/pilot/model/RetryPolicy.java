package com.whereq.pilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry policy for batch system submissions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Total attempts, including the first one
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Backoff step in milliseconds, attempt n waits n times this
     */
    @Builder.Default
    private long backoffMs = 1000;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Reactor retry with linear backoff, the last failure is propagated as is
     */
    public Retry toRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries() + 1;
            if (attempt >= maxAttempts) {
                return Mono.error(signal.failure());
            }
            return Mono.delay(Duration.ofMillis(backoffMs * attempt));
        }));
    }
}
