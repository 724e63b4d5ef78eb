package com.agentme.api.trust;

/**
 * Reputation effects of dispute resolution.
 */
public enum ReputationEvent {
    /** Juror voted with the majority: counts as a successful zero-volume transaction. */
    COHERENT_VOTE,
    /** Party prevailed in a dispute. */
    DISPUTE_WON,
    /** Party lost a dispute: a failed transaction and one more dispute lost. */
    DISPUTE_LOST
}
