package io.github.yok.sheetlink.core;

import io.github.yok.sheetlink.mapping.RejectionReason;

/**
 * Reasons a row was not written, plus the fatal reasons that end a run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum FailureReason {

    // Value cannot be converted to the column type
    TYPE_COERCION_FAILED,

    // Non-nullable column would receive null
    REQUIRED_VALUE_MISSING,

    // Update row without a key value
    MISSING_KEY_VALUE,

    // Update matched no table row
    KEY_NOT_FOUND,

    // Unique, primary-key, foreign-key, check or not-null constraint rejected the row
    CONSTRAINT_VIOLATION,

    // Lock wait timed out or the statement lost a deadlock
    LOCK_TIMEOUT,

    // Any other database error
    DATABASE_ERROR,

    // Connection dropped; fatal for the run
    CONNECTION_LOST,

    // Source became unreadable mid-run; fatal for the run
    SOURCE_READ_FAILED;

    /**
     * Maps a projection rejection to its failure reason.
     *
     * @param reason rejection reason
     * @return failure reason of the same name
     */
    public static FailureReason fromRejection(RejectionReason reason) {
        switch (reason) {
            case TYPE_COERCION_FAILED:
                return TYPE_COERCION_FAILED;
            case REQUIRED_VALUE_MISSING:
                return REQUIRED_VALUE_MISSING;
            default:
                throw new IllegalArgumentException("Unknown rejection reason: " + reason);
        }
    }
}
