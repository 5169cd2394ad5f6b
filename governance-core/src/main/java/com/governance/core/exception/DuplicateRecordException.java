package com.governance.core.exception;

/**
 * Thrown by an insert-if-absent when another writer got there first.
 */
public class DuplicateRecordException extends GovernanceException {

    public static final String ERROR_CODE = "DUPLICATE_RECORD";

    public DuplicateRecordException(String entityType, String key) {
        super(ERROR_CODE, String.format(
            "%s already exists for key: %s",
            entityType, key
        ));
    }
}
