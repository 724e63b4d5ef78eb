package com.agentme.core.error;

/**
 * Not enough balance, stake, withdrawable accrual or eligible jurors.
 */
public class InsufficientResourceException extends SettlementException {

    public InsufficientResourceException(ErrorCode code, String message) {
        super(code, message);
    }
}
