package com.pocketping.app.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.gateway.events.OutgoingEvent;
import com.pocketping.gateway.events.SseBroadcaster;
import com.pocketping.gateway.events.SseSubscriber;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code GET /api/events/stream}: outgoing events as Server-Sent Events.
 * <p>
 * Each connection gets its own subscriber and a task that drains it,
 * writing a {@code :heartbeat} comment whenever nothing was published for
 * one heartbeat interval. A failed write means the client went away; the
 * task then unsubscribes and exits.
 */
@Slf4j
@RestController
public class EventStreamController implements DisposableBean {

    private final SseBroadcaster broadcaster;
    private final long heartbeatMs;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private final AtomicInteger threadIds = new AtomicInteger();
    private final ExecutorService streams = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "sse-stream-" + threadIds.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public EventStreamController(SseBroadcaster broadcaster,
            @Value("${pocketping.sse.heartbeat-ms:30000}") long heartbeatMs) {
        this.broadcaster = broadcaster;
        this.heartbeatMs = heartbeatMs;
    }

    @GetMapping(value = "/api/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(HttpServletResponse response) {
        response.setHeader("Cache-Control", "no-cache");
        response.setHeader("X-Accel-Buffering", "no");

        SseEmitter emitter = new SseEmitter(0L);
        SseSubscriber subscriber = broadcaster.subscribe();
        emitter.onCompletion(subscriber::close);
        emitter.onTimeout(subscriber::close);
        emitter.onError(error -> subscriber.close());

        streams.execute(() -> drain(emitter, subscriber));
        return emitter;
    }

    private void drain(SseEmitter emitter, SseSubscriber subscriber) {
        try {
            emitter.send(SseEmitter.event().comment("connected"));
            while (!subscriber.isClosed()) {
                OutgoingEvent event = subscriber.poll(heartbeatMs, TimeUnit.MILLISECONDS);
                if (subscriber.isClosed()) {
                    break;
                }
                if (event == null) {
                    emitter.send(SseEmitter.event().comment("heartbeat"));
                } else {
                    emitter.send(SseEmitter.event().data(toJson(event), MediaType.APPLICATION_JSON));
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE subscriber {} gone: {}", subscriber.getId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            subscriber.close();
        }
    }

    private String toJson(OutgoingEvent event) throws JsonProcessingException {
        return mapper.writeValueAsString(event);
    }

    @Override
    public void destroy() {
        broadcaster.closeAll();
        streams.shutdownNow();
    }
}
