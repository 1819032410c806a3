package com.platform.podset.error;

/**
 * Raised when a pod cannot be linked to its PodSet.
 */
public class OwnerReferenceException extends OperatorException {

    public OwnerReferenceException(String message) {
        super(ErrorCode.OWNER_REFERENCE_INVALID, message);
    }
}
