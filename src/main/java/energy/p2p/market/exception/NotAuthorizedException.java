package energy.p2p.market.exception;

/**
 * Caller is not allowed to perform the operation on this order
 */
public class NotAuthorizedException extends ValidationException {
    public NotAuthorizedException(String message) {
        super(message);
    }
}
