package energy.p2p.market.settlement;

import lombok.extern.slf4j.Slf4j;

/**
 * Settlement gateway paying out of the market escrow ledger.
 * Every failure is contained here and reported as false.
 */
@Slf4j
public class LedgerSettlementGateway implements SettlementGateway {

    private final EscrowLedger ledger;

    public LedgerSettlementGateway(EscrowLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public boolean transfer(String to, long amount) {
        if (to == null) {
            log.warn("Transfer without recipient: amount={}", amount);
            return false;
        }
        if (ledger.rejectsIncoming(to)) {
            log.warn("Transfer rejected by recipient: to={}, amount={}", to, amount);
            return false;
        }

        try {
            ledger.moveFromEscrow(to, amount);
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            log.warn("Transfer failed: to={}, amount={}, error={}", to, amount, e.getMessage());
            return false;
        }

        log.debug("Transfer completed: to={}, amount={}", to, amount);
        return true;
    }
}
