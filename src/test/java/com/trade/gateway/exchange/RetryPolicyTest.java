package com.trade.gateway.exchange;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 退避策略测试
 */
class RetryPolicyTest {

    @Test
    void testExponentialBaseDelay() {
        RetryPolicy policy = new RetryPolicy(5, 1000);
        assertEquals(1000, policy.baseDelay(1));
        assertEquals(2000, policy.baseDelay(2));
        assertEquals(4000, policy.baseDelay(3));
        assertEquals(8000, policy.baseDelay(4));
    }

    @Test
    void testDelayIsCapped() {
        RetryPolicy policy = new RetryPolicy(100, 1000);
        assertEquals(RetryPolicy.MAX_DELAY_MS, policy.baseDelay(10));
        assertEquals(RetryPolicy.MAX_DELAY_MS, policy.baseDelay(80));
        assertEquals(RetryPolicy.MAX_DELAY_MS, policy.delayFor(6, 0.99));
    }

    @Test
    void testJitterBounds() {
        RetryPolicy policy = new RetryPolicy(3, 1000);
        assertEquals(1000, policy.delayFor(1, 0.0));
        assertEquals(1250, policy.delayFor(1, 1.0));
        long delay = policy.delayFor(2, 0.5);
        assertTrue(delay >= 2000 && delay <= 2500);
    }

    @Test
    void testDelaysNeverDecrease() {
        RetryPolicy policy = RetryPolicy.defaults();
        long previous = 0;
        for (int attempt = 1; attempt <= 20; attempt++) {
            long delay = policy.delayFor(attempt, 0.0);
            assertTrue(delay >= previous);
            assertTrue(delay <= RetryPolicy.MAX_DELAY_MS);
            previous = delay;
        }
    }

    @Test
    void testAttemptBudget() {
        assertEquals(3, RetryPolicy.defaults().maxAttempts());
        assertEquals(1, new RetryPolicy(0, 100).maxAttempts());
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1));
    }
}
