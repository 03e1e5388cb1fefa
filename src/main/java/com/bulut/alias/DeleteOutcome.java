package com.bulut.alias;

/**
 * Outcome of an alias deletion attempt.
 */
public enum DeleteOutcome {
    DELETED,
    NOT_FOUND,
    /**
     * Requesting address is not the registered owner, or its proof did not verify.
     */
    NOT_OWNER
}
