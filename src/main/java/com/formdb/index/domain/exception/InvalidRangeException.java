package com.formdb.index.domain.exception;

public class InvalidRangeException extends IndexingException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
