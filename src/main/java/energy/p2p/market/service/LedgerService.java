package energy.p2p.market.service;

import energy.p2p.market.dto.LedgerBalanceResponse;
import energy.p2p.market.engine.MarketSession;
import energy.p2p.market.settlement.EscrowLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Read access to the escrow ledger plus the recipient rejection switch
 */
@Slf4j
@Service
public class LedgerService {

    public static final String ESCROW_ACCOUNT = "escrow";

    @Autowired
    private MarketSession marketSession;

    /**
     * Value held by the market, including over-payments and payments stranded by failed transfers
     */
    public LedgerBalanceResponse getEscrowBalance() {
        synchronized (marketSession) {
            return LedgerBalanceResponse.builder()
                    .account(ESCROW_ACCOUNT)
                    .balance(marketSession.getLedger().getEscrowBalance())
                    .build();
        }
    }

    public LedgerBalanceResponse getBalance(String participantId) {
        synchronized (marketSession) {
            EscrowLedger ledger = marketSession.getLedger();
            return LedgerBalanceResponse.builder()
                    .account(participantId)
                    .balance(ledger.getBalance(participantId))
                    .rejectsIncoming(ledger.rejectsIncoming(participantId))
                    .build();
        }
    }

    /**
     * Make a participant refuse (or accept again) incoming settlement transfers
     */
    public LedgerBalanceResponse setRejectsIncoming(String participantId, boolean rejecting) {
        synchronized (marketSession) {
            marketSession.getLedger().setRejectsIncoming(participantId, rejecting);
        }
        log.info("Updated incoming transfer policy: participantId={}, rejecting={}", participantId, rejecting);
        return getBalance(participantId);
    }
}
