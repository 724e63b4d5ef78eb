package com.agentme.core.error;

/**
 * A cooldown, deadline or window makes the operation premature or too late.
 */
public class TemporalException extends SettlementException {

    public TemporalException(ErrorCode code, String message) {
        super(code, message);
    }
}
