package com.luanvv.parker.core;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RateLimiter {
    private final Bucket bucket;

    public RateLimiter(Config.RateLimit cfg) {
        if (cfg.getPermitsPerSecond() <= 0) {
            log.info("CRM request pacing disabled");
            bucket = null;
            return;
        }
        int burst = Math.max(cfg.getBurst(), 1);
        // one permit per period, so rates below 1/s are kept as configured
        Duration period = Duration.ofNanos(Math.max(1L, Math.round(1_000_000_000d / cfg.getPermitsPerSecond())));
        Bandwidth limit = Bandwidth.builder()
                .capacity(burst)
                .refillGreedy(1, period)
                .build();
        bucket = Bucket.builder().addLimit(limit).build();
    }

    public void acquire() {
        if (bucket == null || bucket.tryConsume(1)) {
            return;
        }
        log.debug("Request budget exhausted, waiting for a permit");
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrmNetworkException("Interrupted while waiting for rate limiter", e);
        }
    }

    /** Permits available right now; {@link Long#MAX_VALUE} when pacing is off. */
    public long availablePermits() {
        return bucket == null ? Long.MAX_VALUE : bucket.getAvailableTokens();
    }
}
