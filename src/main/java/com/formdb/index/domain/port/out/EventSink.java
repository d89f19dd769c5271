package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.ChangeEvent;

/**
 * Delivery handle owned by whatever transport serves a subscriber (socket, queue or test double).
 */
@FunctionalInterface
public interface EventSink {

    void deliver(ChangeEvent event);
}
