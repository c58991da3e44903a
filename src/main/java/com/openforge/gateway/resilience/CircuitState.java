package com.openforge.gateway.resilience;

/**
 * Breaker states.
 *
 *   CLOSED ──(failures ≥ threshold)──▶ OPEN
 *   OPEN ──(reset timeout elapsed, next request)──▶ HALF_OPEN
 *   HALF_OPEN ──(2 consecutive successes)──▶ CLOSED
 *   HALF_OPEN ──(failure)──▶ OPEN
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /** Lower-case name used in JSON and logs. */
    public String label() {
        return name().toLowerCase();
    }
}
