package com.formdb.index.domain.model;

public record QueryResult<T>(
        T value,
        ResultOrigin origin
) {
    public boolean fromCache() {
        return origin == ResultOrigin.CACHE;
    }
}
