package com.pocketping.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.gateway.router.EventDecoder;
import com.pocketping.gateway.router.EventRouter;
import com.pocketping.gateway.router.IncomingEventType;
import com.pocketping.gateway.router.InvalidEventException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound events from the host backend: the {@code {type, ...}} envelope on
 * {@code /api/events} plus one convenience route per common event.
 * <p>
 * Every accepted event is answered {@code {"ok":true}} once the adapters have
 * been called, whatever they returned.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class EventsController {

    private static final Map<String, Object> OK = Map.of("ok", true);

    private final EventRouter router;
    private final EventDecoder decoder;

    public EventsController(EventRouter router) {
        this.router = router;
        this.decoder = router.getDecoder();
    }

    @PostMapping("/events")
    public Map<String, Object> events(@RequestBody(required = false) String body) {
        router.dispatch(decoder.parse(body));
        return OK;
    }

    @PostMapping("/sessions")
    public Map<String, Object> sessions(@RequestBody(required = false) String body) {
        router.dispatch(decoder.newSession(decoder.parse(body)));
        return OK;
    }

    @PostMapping("/messages")
    public Map<String, Object> messages(@RequestBody(required = false) String body) {
        return dispatch(IncomingEventType.VISITOR_MESSAGE, body);
    }

    @PostMapping("/operator/status")
    public Map<String, Object> operatorStatus(@RequestBody(required = false) String body) {
        return dispatch(IncomingEventType.OPERATOR_STATUS, body);
    }

    @PostMapping("/custom-events")
    public Map<String, Object> customEvents(@RequestBody(required = false) String body) {
        return dispatch(IncomingEventType.CUSTOM_EVENT, body);
    }

    @PostMapping("/disconnect")
    public Map<String, Object> disconnect(@RequestBody(required = false) String body) {
        return dispatch(IncomingEventType.VISITOR_DISCONNECT, body);
    }

    private Map<String, Object> dispatch(IncomingEventType type, String body) {
        JsonNode payload = decoder.parse(body);
        router.dispatch(decoder.decode(type, payload));
        return OK;
    }

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<Map<String, Object>> invalidEvent(InvalidEventException e) {
        log.debug("Rejected event: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
