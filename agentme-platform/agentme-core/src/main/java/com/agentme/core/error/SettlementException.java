package com.agentme.core.error;

import java.util.Objects;

/**
 * Base exception for every rejected settlement operation.
 * <p>
 * Raised before any state change; the surrounding transaction guarantees that a failed
 * operation leaves balances and lifecycle states untouched.
 */
public abstract class SettlementException extends RuntimeException {

    private final ErrorCode code;

    protected SettlementException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "Error code cannot be null");
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code.label() + "]: " + getMessage();
    }
}
