package energy.p2p.market.exception;

/**
 * Invalid order request or order used with the wrong side
 */
public class InvalidOrderException extends ValidationException {
    public InvalidOrderException(String message) {
        super(message);
    }
}
