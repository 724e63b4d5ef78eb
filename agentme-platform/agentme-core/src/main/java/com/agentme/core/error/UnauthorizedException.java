package com.agentme.core.error;

public class UnauthorizedException extends SettlementException {

    public UnauthorizedException(ErrorCode code, String message) {
        super(code, message);
    }
}
