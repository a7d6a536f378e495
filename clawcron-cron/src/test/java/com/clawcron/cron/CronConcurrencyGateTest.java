package com.clawcron.cron;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CronConcurrencyGateTest {

    @Test
    void admitsUpToCapacity() {
        CronConcurrencyGate gate = new CronConcurrencyGate(2);
        assertTrue(gate.tryAcquire());
        assertTrue(gate.tryAcquire());
        assertFalse(gate.tryAcquire());
        assertEquals(2, gate.inFlight());
    }

    @Test
    void releaseFreesASlot() {
        CronConcurrencyGate gate = new CronConcurrencyGate(1);
        assertTrue(gate.tryAcquire());
        assertFalse(gate.tryAcquire());
        gate.release();
        assertEquals(0, gate.inFlight());
        assertTrue(gate.tryAcquire());
    }

    @Test
    void releaseNeverGoesNegative() {
        CronConcurrencyGate gate = new CronConcurrencyGate(1);
        gate.release();
        gate.release();
        assertEquals(0, gate.inFlight());
        assertTrue(gate.tryAcquire());
        assertFalse(gate.tryAcquire());
    }

    @Test
    void capacityClampedToOne() {
        CronConcurrencyGate gate = new CronConcurrencyGate(0);
        assertEquals(1, gate.capacity());
        assertTrue(gate.tryAcquire());
        assertFalse(gate.tryAcquire());
    }
}
