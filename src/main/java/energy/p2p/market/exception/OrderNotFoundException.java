package energy.p2p.market.exception;

/**
 * Order id does not reference an order in the book
 */
public class OrderNotFoundException extends ValidationException {

    public OrderNotFoundException(long orderId) {
        super("Order not found: " + orderId);
    }
}
