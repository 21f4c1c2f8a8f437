package com.pocketping.gateway.events;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Best-effort fan-out of outgoing events to stream subscribers.
 * <p>
 * Each subscriber owns a small bounded queue; when it is full the new event
 * is dropped for that subscriber and the publisher never blocks.
 */
@Slf4j
public class SseBroadcaster {

    public static final int DEFAULT_QUEUE_CAPACITY = 10;

    private final Set<SseSubscriber> subscribers = ConcurrentHashMap.newKeySet();
    private final int queueCapacity;

    public SseBroadcaster() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    public SseBroadcaster(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    /** Register a new subscriber; close it to unsubscribe. */
    public SseSubscriber subscribe() {
        SseSubscriber subscriber = new SseSubscriber(queueCapacity, this::unsubscribe);
        subscribers.add(subscriber);
        log.info("SSE subscriber connected ({} active)", subscribers.size());
        return subscriber;
    }

    void unsubscribe(SseSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            log.info("SSE subscriber disconnected ({} active)", subscribers.size());
        }
    }

    public void publish(OutgoingEvent event) {
        for (SseSubscriber subscriber : subscribers) {
            if (!subscriber.offer(event)) {
                log.warn("SSE subscriber {} queue full, dropping {}", subscriber.getId(),
                        event.getType().getWireName());
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /** Close every subscriber. */
    public void closeAll() {
        for (SseSubscriber subscriber : subscribers) {
            subscriber.close();
        }
    }
}
