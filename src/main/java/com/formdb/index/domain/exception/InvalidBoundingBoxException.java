package com.formdb.index.domain.exception;

public class InvalidBoundingBoxException extends IndexingException {

    public InvalidBoundingBoxException(String message) {
        super(message);
    }
}
