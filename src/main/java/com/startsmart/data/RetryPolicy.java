package com.startsmart.data;

import com.startsmart.config.Config;
import com.startsmart.core.UpstreamUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Supplier;

/**
 * Bounded exponential backoff for upstream reads: waits {@code backoffMs * 2^attempt} between tries.
 */
public final class RetryPolicy {
    private static final Logger LOG = LogManager.getLogger(RetryPolicy.class);

    private final int maxRetry;
    private final long backoffMs;

    public RetryPolicy(int maxRetry, long backoffMs) {
        this.maxRetry = Math.max(0, maxRetry);
        this.backoffMs = Math.max(0L, backoffMs);
    }

    public static RetryPolicy fromConfig(Config config) {
        return new RetryPolicy(config.getInt("source.retry.max", 2), config.getLong("source.retry.backoff_ms", 400L));
    }

    public int maxRetry() {
        return maxRetry;
    }

    public <T> T call(String label, Supplier<T> action) {
        UpstreamUnavailableException last = null;
        for (int attempt = 0; attempt <= maxRetry; attempt++) {
            try {
                return action.get();
            } catch (UpstreamUnavailableException e) {
                last = e;
                if (attempt >= maxRetry) {
                    break;
                }
                long waitMs = backoffMs * (1L << attempt);
                LOG.warn("{} failed (attempt {}/{}), retrying in {}ms: {}", label, attempt + 1, maxRetry + 1, waitMs, e.getMessage());
                try {
                    Thread.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new UpstreamUnavailableException(label + " interrupted during retry backoff", ie);
                }
            }
        }
        throw new UpstreamUnavailableException(label + " unavailable after " + (maxRetry + 1) + " attempts", last);
    }
}
