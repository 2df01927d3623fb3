package energy.p2p.market.enums;

/**
 * Broad classification of business failures reported to callers
 */
public enum ErrorCategory {
    /**
     * Bad reference, wrong caller or insufficient funds; detected before any mutation
     */
    VALIDATION,

    /**
     * The caller's view of the order state is stale (not matched yet, already executed)
     */
    STATE_CONFLICT,

    /**
     * Settlement transfer failed after validation passed
     */
    TRANSFER
}
