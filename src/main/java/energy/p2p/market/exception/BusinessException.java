package energy.p2p.market.exception;

import energy.p2p.market.enums.ErrorCategory;

/**
 * Base class for failures of market operations
 */
public abstract class BusinessException extends RuntimeException {

    protected BusinessException(String message) {
        super(message);
    }

    public abstract ErrorCategory getCategory();
}
