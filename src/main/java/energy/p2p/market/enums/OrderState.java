package energy.p2p.market.enums;

/**
 * Order lifecycle. Transitions are strictly forward: PLACED -> MATCHED -> EXECUTED.
 */
public enum OrderState {
    /**
     * Order is resting in the book without a counterparty
     */
    PLACED,

    /**
     * Order has been paired with a counterparty and carries the settlement price
     */
    MATCHED,

    /**
     * Payment has been transferred; set on both legs of a match together
     */
    EXECUTED
}
