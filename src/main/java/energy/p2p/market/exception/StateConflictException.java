package energy.p2p.market.exception;

import energy.p2p.market.enums.ErrorCategory;

/**
 * The order is not in the state the caller assumed
 */
public class StateConflictException extends BusinessException {

    public StateConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.STATE_CONFLICT;
    }
}
