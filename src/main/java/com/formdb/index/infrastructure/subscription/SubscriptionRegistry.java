package com.formdb.index.infrastructure.subscription;

import com.formdb.index.domain.model.ChangeEvent;
import com.formdb.index.domain.model.SubscriptionFilter;
import com.formdb.index.domain.model.SubscriptionHandle;
import com.formdb.index.domain.port.in.SubscriptionService;
import com.formdb.index.domain.port.out.ChangeEventPublisher;
import com.formdb.index.domain.port.out.EventSink;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publish/subscribe registry keyed by database, decoupled from transport.
 *
 * <p>Delivery is best effort and at most once. Each database has one delivery thread fed by a
 * bounded queue, so publishing never waits on a sink and every subscriber sees that database's
 * events in publish order. An event that finds the queue full is dropped.
 */
@Component
public class SubscriptionRegistry implements SubscriptionService, ChangeEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConcurrentMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final SubscriptionConfig config;

    public SubscriptionRegistry(SubscriptionConfig config) {
        if (config.getQueueCapacity() <= 0) {
            throw new IllegalArgumentException(
                    "Subscription queue capacity must be positive, got " + config.getQueueCapacity());
        }
        this.config = config;
    }

    @Override
    public SubscriptionHandle subscribe(String database, SubscriptionFilter filter, EventSink sink) {
        SubscriptionHandle handle = SubscriptionHandle.create(database);
        Subscription subscription = new Subscription(
                handle, filter == null ? SubscriptionFilter.none() : filter, sink, new AtomicBoolean(true));

        // Inside compute so a concurrent unsubscribeAll cannot orphan the topic we join
        topics.compute(database, (db, existing) -> {
            Topic topic = existing == null ? new Topic(db) : existing;
            topic.subscriptions.add(subscription);
            return topic;
        });
        logger.info("Subscription {} joined database {} with filter {}", handle.id(), database, subscription.filter());
        return handle;
    }

    @Override
    public boolean unsubscribe(SubscriptionHandle handle) {
        Topic topic = topics.get(handle.database());
        if (topic == null) {
            return false;
        }

        for (Subscription subscription : topic.subscriptions) {
            if (subscription.handle().id().equals(handle.id())) {
                subscription.active().set(false);
                topic.subscriptions.remove(subscription);
                logger.info("Subscription {} left database {}", handle.id(), handle.database());
                return true;
            }
        }
        return false;
    }

    @Override
    public int unsubscribeAll(String database) {
        Topic topic = topics.remove(database);
        if (topic == null) {
            return 0;
        }
        int closed = topic.close();
        logger.info("Closed {} subscriptions of database {}", closed, database);
        return closed;
    }

    @Override
    public int subscriberCount(String database) {
        Topic topic = topics.get(database);
        return topic == null ? 0 : topic.subscriptions.size();
    }

    /**
     * Queues the event for every matching subscriber of its database.
     *
     * @return number of subscribers the event was queued for, 0 if it was dropped
     */
    @Override
    public int publish(ChangeEvent event) {
        Topic topic = topics.get(event.database());
        if (topic == null) {
            return 0;
        }

        List<Subscription> recipients = topic.subscriptions.stream()
                .filter(subscription -> subscription.filter().matches(event))
                .toList();
        if (recipients.isEmpty()) {
            return 0;
        }

        try {
            topic.delivery.execute(() -> deliver(event, recipients));
        } catch (TaskRejectedException e) {
            logger.warn("Dropped {} event {} for database {}: delivery queue full or closed",
                    event.kind().wireName(), event.recordId(), event.database());
            return 0;
        }

        logger.debug("Queued {} {} event {} for {} subscribers of database {}",
                event.type(), event.kind().wireName(), event.recordId(), recipients.size(), event.database());
        return recipients.size();
    }

    @PreDestroy
    public void shutdown() {
        topics.keySet().forEach(this::unsubscribeAll);
    }

    private void deliver(ChangeEvent event, List<Subscription> recipients) {
        for (Subscription subscription : recipients) {
            // removed after the event was queued: drop silently
            if (!subscription.active().get()) {
                continue;
            }
            try {
                subscription.sink().deliver(event);
            } catch (RuntimeException e) {
                logger.warn("Delivery of {} event {} to subscription {} failed: {}",
                        event.kind().wireName(), event.recordId(), subscription.handle().id(), e.getMessage());
            }
        }
    }

    private final class Topic {
        private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
        private final ThreadPoolTaskExecutor delivery = new ThreadPoolTaskExecutor();

        private Topic(String database) {
            delivery.setCorePoolSize(1);
            delivery.setMaxPoolSize(1);
            delivery.setQueueCapacity(config.getQueueCapacity());
            delivery.setKeepAliveSeconds(config.getIdleSeconds());
            delivery.setAllowCoreThreadTimeOut(true);
            delivery.setThreadNamePrefix("formdb-events-" + database + "-");
            delivery.setDaemon(true);
            delivery.initialize();
        }

        private int close() {
            subscriptions.forEach(subscription -> subscription.active().set(false));
            int closed = subscriptions.size();
            subscriptions.clear();
            delivery.shutdown();
            return closed;
        }
    }

    private record Subscription(
            SubscriptionHandle handle,
            SubscriptionFilter filter,
            EventSink sink,
            AtomicBoolean active
    ) {}
}
