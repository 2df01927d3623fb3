package energy.p2p.market.exception;

import energy.p2p.market.enums.ErrorCategory;
import lombok.Getter;

/**
 * Settlement transfer to the seller failed after all checks passed.
 * No order state was changed, but the payment tendered by the buyer stays
 * in market escrow: there is no refund path.
 */
@Getter
public class SettlementFailedException extends BusinessException {

    private final long orderId;

    private final String recipient;

    private final long settlementAmount;

    /**
     * Payment taken into escrow before the transfer was attempted
     */
    private final long strandedPayment;

    public SettlementFailedException(long orderId, String recipient, long settlementAmount, long strandedPayment) {
        super("Settlement transfer of " + settlementAmount + " to " + recipient + " failed for order " + orderId
                + "; payment of " + strandedPayment + " remains held in market escrow and is not refunded");
        this.orderId = orderId;
        this.recipient = recipient;
        this.settlementAmount = settlementAmount;
        this.strandedPayment = strandedPayment;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TRANSFER;
    }
}
