package com.pocketping.gateway.events;

import com.pocketping.common.infra.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SseBroadcasterTest {

    @Test
    void publish_reachesEverySubscriber() throws Exception {
        SseBroadcaster broadcaster = new SseBroadcaster();
        SseSubscriber a = broadcaster.subscribe();
        SseSubscriber b = broadcaster.subscribe();

        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_STATUS).with("online", true));

        assertEquals(OutgoingEventType.OPERATOR_STATUS, a.poll(1, TimeUnit.SECONDS).getType());
        assertEquals(OutgoingEventType.OPERATOR_STATUS, b.poll(1, TimeUnit.SECONDS).getType());
    }

    @Test
    void publish_fullQueue_dropsNewestWithoutBlocking() throws Exception {
        SseBroadcaster broadcaster = new SseBroadcaster();
        SseSubscriber slow = broadcaster.subscribe();

        for (int i = 0; i < 15; i++) {
            broadcaster.publish(OutgoingEvent.of(OutgoingEventType.MESSAGE_READ).with("seq", i));
        }

        assertEquals(SseBroadcaster.DEFAULT_QUEUE_CAPACITY, slow.pending());
        assertEquals(0, slow.poll(1, TimeUnit.SECONDS).get("seq"));
    }

    @Test
    void close_unsubscribesOnce() {
        SseBroadcaster broadcaster = new SseBroadcaster();
        SseSubscriber subscriber = broadcaster.subscribe();
        assertEquals(1, broadcaster.subscriberCount());

        subscriber.close();
        subscriber.close();

        assertTrue(subscriber.isClosed());
        assertEquals(0, broadcaster.subscriberCount());
    }

    @Test
    void closedSubscriber_receivesNothing() throws Exception {
        SseBroadcaster broadcaster = new SseBroadcaster();
        SseSubscriber subscriber = broadcaster.subscribe();
        subscriber.close();

        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_STATUS));

        assertNull(subscriber.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void outgoingEvent_serializesFlatAndSkipsNulls() throws Exception {
        OutgoingEvent event = OutgoingEvent.of(OutgoingEventType.MESSAGE_EDITED)
                .with("sessionId", "s1")
                .with("messageId", "m1")
                .with("content", null);

        String json = JsonSupport.newMapper().writeValueAsString(event);

        assertEquals("{\"type\":\"message_edited\",\"sessionId\":\"s1\",\"messageId\":\"m1\"}", json);
    }
}
