package energy.p2p.market.exception;

/**
 * Invalid installation registration request
 */
public class InvalidInstallationException extends ValidationException {
    public InvalidInstallationException(String message) {
        super(message);
    }
}
