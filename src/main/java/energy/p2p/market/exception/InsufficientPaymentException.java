package energy.p2p.market.exception;

/**
 * Exception thrown when the tendered payment does not cover the required amount
 */
public class InsufficientPaymentException extends ValidationException {
    public InsufficientPaymentException(String message) {
        super(message);
    }
}
