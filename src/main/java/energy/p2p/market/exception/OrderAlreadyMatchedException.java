package energy.p2p.market.exception;

public class OrderAlreadyMatchedException extends StateConflictException {

    public OrderAlreadyMatchedException(long orderId, Long matchedOrderId) {
        super("Order " + orderId + " is already matched with order " + matchedOrderId);
    }
}
