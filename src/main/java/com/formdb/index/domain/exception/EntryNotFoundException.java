package com.formdb.index.domain.exception;

/**
 * The targeted index entry does not exist.
 */
public class EntryNotFoundException extends IndexingException {

    public EntryNotFoundException(String message) {
        super(message);
    }
}
