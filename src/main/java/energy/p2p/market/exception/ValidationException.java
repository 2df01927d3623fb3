package energy.p2p.market.exception;

import energy.p2p.market.enums.ErrorCategory;

/**
 * Request rejected before any state was touched; retrying with corrected input may succeed
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
