package com.formdb.index.domain.model;

/**
 * Where a read-path result came from. Informational only.
 */
public enum ResultOrigin {
    CACHE,
    INDEX,
    FALLBACK
}
