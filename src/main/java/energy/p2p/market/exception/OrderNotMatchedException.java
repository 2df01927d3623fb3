package energy.p2p.market.exception;

public class OrderNotMatchedException extends StateConflictException {

    public OrderNotMatchedException(long orderId) {
        super("Order not matched: " + orderId);
    }
}
