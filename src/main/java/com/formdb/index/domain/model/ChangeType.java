package com.formdb.index.domain.model;

public enum ChangeType {
    INSERT,
    DELETE
}
