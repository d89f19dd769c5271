package com.formdb.index.domain.exception;

public class IndexAlreadyExistsException extends IndexingException {

    public IndexAlreadyExistsException(String message) {
        super(message);
    }
}
