package energy.p2p.market.enums;

/**
 * Order side - BUY or SELL
 */
public enum OrderSide {
    /**
     * Buy order - the initiator is recorded as buyer, seller is filled on match
     */
    BUY,

    /**
     * Sell order - the initiator is recorded as seller, buyer is filled on match
     */
    SELL
}
