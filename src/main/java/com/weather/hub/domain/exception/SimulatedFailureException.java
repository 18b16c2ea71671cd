package com.weather.hub.domain.exception;

/**
 * Deliberate failure raised on every n-th upstream forecast call so the
 * error paths show up in traces and dashboards.
 */
public class SimulatedFailureException extends RuntimeException {

    private final long callNumber;

    public SimulatedFailureException(long callNumber) {
        super("Simulated failure on forecast call #" + callNumber);
        this.callNumber = callNumber;
    }

    public long getCallNumber() {
        return callNumber;
    }
}
