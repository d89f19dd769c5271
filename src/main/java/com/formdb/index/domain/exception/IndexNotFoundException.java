package com.formdb.index.domain.exception;

/**
 * No index exists for the requested database or series.
 * The read path treats this as a signal to fall back to a journal scan.
 */
public class IndexNotFoundException extends IndexingException {

    public IndexNotFoundException(String message) {
        super(message);
    }
}
