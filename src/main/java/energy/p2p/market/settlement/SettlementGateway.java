package energy.p2p.market.settlement;

/**
 * Moves value out of the market to a participant.
 * A failed transfer is reported through the return value, never by throwing,
 * so the caller can abort its own state change.
 */
@FunctionalInterface
public interface SettlementGateway {

    /**
     * @param to     recipient identity
     * @param amount value to move
     * @return true if the recipient was credited
     */
    boolean transfer(String to, long amount);
}
