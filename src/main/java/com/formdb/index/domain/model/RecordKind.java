package com.formdb.index.domain.model;

import java.util.Arrays;

public enum RecordKind {
    FEATURE("feature"),
    TIME_SERIES("timeseries");

    private final String wireName;

    RecordKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecordKind fromWireName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown record kind: " + name));
    }
}
