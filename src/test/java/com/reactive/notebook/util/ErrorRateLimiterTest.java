package com.reactive.notebook.util;

import static org.junit.Assert.*;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

public class ErrorRateLimiterTest {

    @Test
    public void testSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        RuntimeException e = new RuntimeException("test failure");

        assertTrue(limiter.log("first", e));
        assertFalse(limiter.log("second", e));
        assertFalse(limiter.log("third", e));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testLogsAgainAfterInterval() throws Exception {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 1);
        RuntimeException e = new RuntimeException("test failure");

        assertTrue(limiter.log("first", e));
        Thread.sleep(5);
        assertTrue(limiter.log("second", e));
        assertEquals(0, limiter.suppressedCount());
    }
}
