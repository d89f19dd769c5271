package com.formdb.index.domain.port.in;

import com.formdb.index.domain.model.SubscriptionFilter;
import com.formdb.index.domain.model.SubscriptionHandle;
import com.formdb.index.domain.port.out.EventSink;

public interface SubscriptionService {

    SubscriptionHandle subscribe(String database, SubscriptionFilter filter, EventSink sink);

    /**
     * @return false if the handle was already removed
     */
    boolean unsubscribe(SubscriptionHandle handle);

    /**
     * @return number of subscriptions closed
     */
    int unsubscribeAll(String database);

    int subscriberCount(String database);
}
