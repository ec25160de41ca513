package com.luanvv.parker.core;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;

    public <T> T runWithRetry(String opName, Supplier<T> call) {
        long delay = Math.max(100, cfg.getBackoffMs());
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        int attempts = 0;
        CrmNetworkException last = null;
        while (attempts < maxAttempts) {
            attempts++;
            try {
                return call.get();
            } catch (CrmNetworkException e) {
                last = e;
                log.warn("{} failed on attempt {}/{}: {}", opName, attempts, maxAttempts, e.getMessage());
                if (attempts >= maxAttempts) break;
                sleep(delay);
                delay = Math.min(cfg.getMaxBackoffMs(), delay * 2);
            }
        }
        throw last != null ? last : new CrmNetworkException(opName + " failed", null);
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrmNetworkException("Interrupted while backing off", e);
        }
    }
}
