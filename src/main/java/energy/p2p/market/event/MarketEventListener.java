package energy.p2p.market.event;

/**
 * Subscriber to the market event log
 */
@FunctionalInterface
public interface MarketEventListener {

    void onEvent(MarketEvent event);
}
