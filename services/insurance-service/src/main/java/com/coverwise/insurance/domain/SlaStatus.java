package com.coverwise.insurance.domain;

/**
 * Processing time of a claim against its SLA.
 *
 * @param daysElapsed   processing days for a resolved claim, days since submission otherwise
 * @param daysRemaining null for a resolved claim, never negative otherwise
 */
public record SlaStatus(
    State state,
    int slaDays,
    long daysElapsed,
    Long daysRemaining,
    boolean withinSla
) {
    public enum State {
        COMPLETED,
        IN_PROGRESS
    }
}
