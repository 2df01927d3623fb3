package energy.p2p.market.exception;

public class OrderAlreadyExecutedException extends StateConflictException {

    public OrderAlreadyExecutedException(long orderId) {
        super("Order already executed: " + orderId);
    }
}
