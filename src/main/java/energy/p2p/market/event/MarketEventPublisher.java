package energy.p2p.market.event;

/**
 * One-way sink for market notifications. Implementations must not throw
 * back into the caller.
 */
@FunctionalInterface
public interface MarketEventPublisher {

    void publish(MarketEvent event);
}
