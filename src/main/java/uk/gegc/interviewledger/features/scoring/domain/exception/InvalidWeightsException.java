package uk.gegc.interviewledger.features.scoring.domain.exception;

import uk.gegc.interviewledger.shared.exception.ErrorCode;
import uk.gegc.interviewledger.shared.exception.LedgerException;

/**
 * Raised when a weight set does not sum to 1.0 or carries a negative weight.
 */
public class InvalidWeightsException extends LedgerException {

    public InvalidWeightsException(String message) {
        super(ErrorCode.INVALID_WEIGHTS, message);
    }
}
