package com.agentme.core.error;

/**
 * The target is not in a state that allows the requested transition.
 */
public class InvalidStateException extends SettlementException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(ErrorCode code, String message) {
        super(code, message);
    }
}
