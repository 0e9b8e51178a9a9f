package com.reactive.notebook.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often a recurring failure is logged, so a misbehaving listener
 * or a flapping client cannot flood the log. Suppressed occurrences are
 * counted and reported with the next logged one.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE / 2);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return whether the message was logged */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
