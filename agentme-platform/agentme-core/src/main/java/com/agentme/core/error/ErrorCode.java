package com.agentme.core.error;

/**
 * Stable codes naming the rule an operation violated.
 */
public enum ErrorCode {

    // Validation
    INVALID_AMOUNT(ErrorKind.VALIDATION, "InvalidAmount"),
    INVALID_DEADLINE(ErrorKind.VALIDATION, "InvalidDeadline"),
    INVALID_TIME_RANGE(ErrorKind.VALIDATION, "InvalidTimeRange"),
    INVALID_IDENTIFIER(ErrorKind.VALIDATION, "InvalidIdentifier"),
    INVALID_SHARE(ErrorKind.VALIDATION, "InvalidShare"),
    INVALID_COMMITMENT(ErrorKind.VALIDATION, "InvalidCommitment"),
    AGENT_NOT_REGISTERED(ErrorKind.VALIDATION, "AgentNotRegistered"),
    AGENT_ALREADY_REGISTERED(ErrorKind.VALIDATION, "AgentAlreadyRegistered"),
    AGENT_INACTIVE(ErrorKind.VALIDATION, "AgentInactive"),
    SELF_ENDORSEMENT(ErrorKind.VALIDATION, "SelfEndorsement"),
    DUPLICATE_ENDORSEMENT(ErrorKind.VALIDATION, "DuplicateEndorsement"),
    ENDORSEMENT_NOT_FOUND(ErrorKind.VALIDATION, "EndorsementNotFound"),
    ESCROW_NOT_FOUND(ErrorKind.VALIDATION, "EscrowNotFound"),
    STREAM_NOT_FOUND(ErrorKind.VALIDATION, "StreamNotFound"),
    DISPUTE_NOT_FOUND(ErrorKind.VALIDATION, "DisputeNotFound"),
    TRUST_BELOW_MINIMUM(ErrorKind.VALIDATION, "TrustBelowMinimum"),

    // State
    INVALID_STATE(ErrorKind.STATE, "InvalidState"),
    NO_WITHDRAWAL_PENDING(ErrorKind.STATE, "NoWithdrawalPending"),
    ALREADY_VOTED(ErrorKind.STATE, "AlreadyVoted"),
    NO_AUTOMATIC_RULE(ErrorKind.STATE, "NoAutomaticRuleApplies"),
    FINAL_ROUND_REACHED(ErrorKind.STATE, "FinalRoundReached"),

    // Authorization
    NOT_AGENT_OWNER(ErrorKind.AUTHORIZATION, "NotAgentOwner"),
    NOT_CLIENT(ErrorKind.AUTHORIZATION, "NotClient"),
    NOT_PROVIDER(ErrorKind.AUTHORIZATION, "NotProvider"),
    NOT_PARTY(ErrorKind.AUTHORIZATION, "NotParty"),
    NOT_SENDER(ErrorKind.AUTHORIZATION, "NotSender"),
    NOT_RECIPIENT(ErrorKind.AUTHORIZATION, "NotRecipient"),
    NOT_CANCELABLE(ErrorKind.AUTHORIZATION, "NotCancelable"),
    NOT_JUROR(ErrorKind.AUTHORIZATION, "NotJuror"),
    MISSING_ROLE(ErrorKind.AUTHORIZATION, "MissingRole"),

    // Temporal
    COOLDOWN_ACTIVE(ErrorKind.TEMPORAL, "CooldownActive"),
    DEADLINE_NOT_REACHED(ErrorKind.TEMPORAL, "DeadlineNotReached"),
    DEADLINE_PASSED(ErrorKind.TEMPORAL, "DeadlinePassed"),
    STREAM_ENDED(ErrorKind.TEMPORAL, "StreamEnded"),
    EVIDENCE_CLOSED(ErrorKind.TEMPORAL, "EvidenceClosed"),
    VOTING_WINDOW_OPEN(ErrorKind.TEMPORAL, "VotingWindowOpen"),
    VOTING_WINDOW_CLOSED(ErrorKind.TEMPORAL, "VotingWindowClosed"),
    APPEAL_WINDOW_OPEN(ErrorKind.TEMPORAL, "AppealWindowOpen"),
    APPEAL_WINDOW_CLOSED(ErrorKind.TEMPORAL, "AppealWindowClosed"),

    // Resource
    INSUFFICIENT_STAKE(ErrorKind.RESOURCE, "InsufficientStake"),
    INSUFFICIENT_BALANCE(ErrorKind.RESOURCE, "InsufficientBalance"),
    EXCEEDS_WITHDRAWABLE(ErrorKind.RESOURCE, "ExceedsWithdrawable"),
    NOTHING_TO_WITHDRAW(ErrorKind.RESOURCE, "NothingToWithdraw"),
    INSUFFICIENT_JURORS(ErrorKind.RESOURCE, "InsufficientJurors"),

    // Precision
    PRECISION_LOSS(ErrorKind.PRECISION, "PrecisionLoss");

    private final ErrorKind kind;
    private final String label;

    ErrorCode(ErrorKind kind, String label) {
        this.kind = kind;
        this.label = label;
    }

    public ErrorKind kind() { return kind; }
    public String label() { return label; }
}
