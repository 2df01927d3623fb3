package energy.p2p.market.enums;

/**
 * Notification types emitted by the market
 */
public enum MarketEventType {
    MATCH_CONFIRMED,
    PAYMENT_SENT,
    PAYMENT_RECEIVED
}
