package energy.p2p.market.engine;

import energy.p2p.market.event.MarketEventLog;
import energy.p2p.market.registry.InstallationRegistry;
import energy.p2p.market.settlement.EscrowLedger;
import energy.p2p.market.settlement.LedgerSettlementGateway;
import energy.p2p.market.settlement.SettlementGateway;
import energy.p2p.market.store.InMemoryOrderStore;
import energy.p2p.market.store.OrderStore;
import lombok.Getter;

/**
 * One independent market: its order book, installation registry, escrow
 * ledger and event log. Nothing is shared between sessions.
 * The session is also the monitor callers synchronize on to run one
 * operation at a time.
 */
@Getter
public class MarketSession {

    private final OrderBook orderBook;

    private final InstallationRegistry installationRegistry;

    private final EscrowLedger ledger;

    private final MarketEventLog eventLog;

    public MarketSession(OrderStore orderStore,
                         EscrowLedger ledger,
                         SettlementGateway settlementGateway,
                         MarketEventLog eventLog,
                         long installationUnitRate) {
        this.ledger = ledger;
        this.eventLog = eventLog;
        this.orderBook = new OrderBook(orderStore, ledger, settlementGateway, eventLog);
        this.installationRegistry = new InstallationRegistry(installationUnitRate, ledger, eventLog);
    }

    /**
     * Session with an in-memory store, a ledger-backed gateway and
     * listener delivery on the publishing thread
     */
    public static MarketSession inMemory(long installationUnitRate) {
        return inMemory(installationUnitRate, new MarketEventLog());
    }

    public static MarketSession inMemory(long installationUnitRate, MarketEventLog eventLog) {
        EscrowLedger ledger = new EscrowLedger();
        return new MarketSession(new InMemoryOrderStore(), ledger, new LedgerSettlementGateway(ledger),
                eventLog, installationUnitRate);
    }
}
