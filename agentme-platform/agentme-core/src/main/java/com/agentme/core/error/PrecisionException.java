package com.agentme.core.error;

public class PrecisionException extends SettlementException {

    public PrecisionException(String message) {
        super(ErrorCode.PRECISION_LOSS, message);
    }
}
