package com.pocketping.common.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void compute_exponential_doublesAndCaps() {
        var policy = new Backoff.Policy(100, 500, 2.0, 0.0, false, 5);
        assertEquals(100, Backoff.compute(policy, 1));
        assertEquals(200, Backoff.compute(policy, 2));
        assertEquals(400, Backoff.compute(policy, 3));
        assertEquals(500, Backoff.compute(policy, 4));
    }

    @Test
    void compute_gatewayReconnect_growsByFiveSeconds() {
        var policy = Backoff.Policy.GATEWAY_RECONNECT;
        assertEquals(5_000, Backoff.compute(policy, 1));
        assertEquals(10_000, Backoff.compute(policy, 2));
        assertEquals(25_000, Backoff.compute(policy, 5));
    }

    @Test
    void exhausted_afterMaxAttempts() {
        var policy = Backoff.Policy.linear(10, 5);
        assertFalse(policy.exhausted(5));
        assertTrue(policy.exhausted(6));
    }

}
