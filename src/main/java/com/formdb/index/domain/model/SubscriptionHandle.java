package com.formdb.index.domain.model;

import java.util.UUID;

public record SubscriptionHandle(
        UUID id,
        String database
) {
    public static SubscriptionHandle create(String database) {
        return new SubscriptionHandle(UUID.randomUUID(), database);
    }
}
