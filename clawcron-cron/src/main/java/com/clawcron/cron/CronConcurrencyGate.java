package com.clawcron.cron;

/**
 * Counter-based admission control bounding simultaneous runs.
 *
 * <p>
 * Not thread-safe on its own: callers hold the cron store monitor, which is
 * the single point through which the dispatcher and service mutate state.
 * </p>
 */
public class CronConcurrencyGate {

    private final int capacity;
    private int inFlight;

    public CronConcurrencyGate(int maxConcurrentRuns) {
        this.capacity = Math.max(1, maxConcurrentRuns);
    }

    /**
     * Take a slot if one is free.
     *
     * @return true when admitted
     */
    public boolean tryAcquire() {
        if (inFlight >= capacity) {
            return false;
        }
        inFlight++;
        return true;
    }

    public void release() {
        if (inFlight > 0) {
            inFlight--;
        }
    }

    public int inFlight() {
        return inFlight;
    }

    public int capacity() {
        return capacity;
    }
}
