package com.agentme.core.error;

/**
 * Malformed input or an identifier that does not resolve.
 */
public class ValidationException extends SettlementException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
