package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.ChangeEvent;

public interface ChangeEventPublisher {

    /**
     * Hand off to every matching subscriber of {@code event.database()} without waiting on delivery; best effort
     * @return number of subscribers the event was queued for
     */
    int publish(ChangeEvent event);
}
