package com.agentme.core.error;

/**
 * Failure categories of settlement operations.
 */
public enum ErrorKind {
    /** Malformed input, unknown identifiers, out-of-range values. */
    VALIDATION,
    /** Operation not allowed from the current lifecycle state. */
    STATE,
    /** Caller lacks the ownership or role the operation requires. */
    AUTHORIZATION,
    /** Cooldown, deadline or voting window not yet reached or already passed. */
    TEMPORAL,
    /** Insufficient balance, stake or eligible jurors. */
    RESOURCE,
    /** Arithmetic would lose value. */
    PRECISION
}
