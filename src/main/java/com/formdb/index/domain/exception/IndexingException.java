package com.formdb.index.domain.exception;

/**
 * Base type for failures raised by the index and cache layer.
 */
public class IndexingException extends RuntimeException {

    public IndexingException(String message) {
        super(message);
    }

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
