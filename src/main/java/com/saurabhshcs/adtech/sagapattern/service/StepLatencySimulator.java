package com.saurabhshcs.adtech.sagapattern.service;

import java.time.Duration;

/**
 * Stands in for the time a real downstream call would take. Zero disables it.
 */
public class StepLatencySimulator {

    private final Duration latency;

    public StepLatencySimulator(Duration latency) {
        this.latency = latency;
    }

    public void pause() {
        pause(1);
    }

    public void pause(int factor) {
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis() * factor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing saga step", e);
        }
    }
}
