package com.agentme.api.access;

/**
 * Privileged operations guarded by role.
 */
public enum Operation {
    RECORD_TRANSACTION,
    SLASH_STAKE,
    ADJUST_REPUTATION,
    SUBMIT_AI_RULING,
    SETTLE_DISPUTE,
    MANAGE_ROLES
}
