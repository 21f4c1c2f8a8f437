package com.pocketping.channel.discord.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketping.channel.discord.DiscordBridgeAdapter;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.inbound.OperatorEvents;
import com.pocketping.common.infra.Backoff;
import com.pocketping.common.infra.HeartbeatRunner;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.common.model.Attachment;
import com.pocketping.common.model.BridgeMessageIds;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Long-lived Discord gateway connection delivering operator messages, edits
 * and deletes written in session threads.
 * <p>
 * Lifecycle: connect, wait for HELLO, start heartbeating, IDENTIFY (or RESUME
 * with the saved session), then dispatch events once READY/RESUMED. A missed
 * heartbeat ack, a socket error, op 7 RECONNECT or op 9 INVALID_SESSION all
 * end in {@link #reconnect}, which retries with a growing delay and gives up
 * after the policy's attempt limit. Every socket carries a generation number
 * so callbacks from a replaced socket are ignored.
 */
@Slf4j
public class DiscordGatewayClient implements AutoCloseable {

    private final String botToken;
    private final GatewayTransport transport;
    private final GatewayUrlResolver urlResolver;
    private final OperatorEventSink sink;
    private final Function<String, String> sessionResolver;
    private final Set<String> allowedBotIds;
    private final Backoff.Policy reconnectPolicy;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private final HeartbeatRunner heartbeat;
    private final ScheduledExecutorService scheduler;
    private final AtomicInteger generation = new AtomicInteger();

    private volatile GatewayState state = GatewayState.DISCONNECTED;
    private volatile boolean exhausted;
    private volatile long lastAckAt;
    private volatile long heartbeatIntervalMs;
    private GatewayTransport.Connection connection;
    private String sessionId;
    private String resumeUrl;
    private Long sequence;
    private boolean resuming;
    private boolean stopped = true;
    private int reconnectAttempts;

    public DiscordGatewayClient(String botToken, GatewayTransport transport, GatewayUrlResolver urlResolver,
            OperatorEventSink sink, Function<String, String> sessionResolver, Collection<String> allowedBotIds,
            Backoff.Policy reconnectPolicy) {
        this.botToken = botToken;
        this.transport = transport;
        this.urlResolver = urlResolver;
        this.sink = sink;
        this.sessionResolver = sessionResolver;
        this.allowedBotIds = allowedBotIds != null ? Set.copyOf(allowedBotIds) : Set.of();
        this.reconnectPolicy = reconnectPolicy;
        this.heartbeat = new HeartbeatRunner("discord-gateway-heartbeat", 41_250, reason -> heartbeatTick());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "discord-gateway-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Gateway client for a bot-mode Discord adapter, over OkHttp WebSockets.
     */
    public static DiscordGatewayClient forAdapter(DiscordBridgeAdapter adapter, String botToken,
            OperatorEventSink sink, Collection<String> allowedBotIds) {
        return new DiscordGatewayClient(botToken, new OkHttpGatewayTransport(),
                () -> adapter.fetchGatewayUrl().get(10, TimeUnit.SECONDS),
                sink, adapter::resolveSessionId, allowedBotIds, Backoff.Policy.GATEWAY_RECONNECT);
    }

    // --- Lifecycle ---

    public synchronized void start() {
        if (!stopped) {
            return;
        }
        stopped = false;
        exhausted = false;
        reconnectAttempts = 0;
        log.info("[discord-gateway] starting");
        open(false);
    }

    /** Manual stop; the only way back to DISCONNECTED besides fatal errors. */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        heartbeat.stop();
        generation.incrementAndGet();
        closeConnection(1000, "shutdown");
        state = GatewayState.DISCONNECTED;
        log.info("[discord-gateway] stopped");
    }

    @Override
    public void close() {
        stop();
        heartbeat.close();
        scheduler.shutdownNow();
    }

    public GatewayState getState() {
        return state;
    }

    /** True after the reconnect attempts ran out; the connection needs a restart. */
    public boolean isExhausted() {
        return exhausted;
    }

    public synchronized String getSessionId() {
        return sessionId;
    }

    public synchronized Long getSequence() {
        return sequence;
    }

    public synchronized int getReconnectAttempts() {
        return reconnectAttempts;
    }

    long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    // --- Connection ---

    private void open(boolean resume) {
        transition(GatewayState.CONNECTING);
        int gen = generation.incrementAndGet();
        resuming = resume && sessionId != null;

        String url;
        try {
            url = resuming && resumeUrl != null ? resumeUrl : urlResolver.resolve();
        } catch (Exception e) {
            log.warn("[discord-gateway] could not resolve gateway URL: {}", e.getMessage());
            reconnect("gateway URL lookup failed", resume);
            return;
        }
        if (url == null || url.isBlank()) {
            reconnect("empty gateway URL", resume);
            return;
        }

        String target = url.contains("?") ? url : url + GatewayOpcodes.GATEWAY_QUERY;
        log.debug("[discord-gateway] connecting (resume={})", resuming);
        try {
            connection = transport.connect(target, new GenerationListener(gen));
        } catch (RuntimeException e) {
            log.warn("[discord-gateway] connect failed: {}", e.getMessage());
            resuming = false;
            reconnect("connect failed", false);
        }
    }

    /**
     * Tear down the current socket and schedule the next attempt.
     *
     * @param resume whether the next attempt may RESUME the saved session
     */
    synchronized void reconnect(String reason, boolean resume) {
        if (stopped) {
            return;
        }
        heartbeat.stop();
        generation.incrementAndGet();
        closeConnection(4000, "reconnect");

        reconnectAttempts++;
        if (reconnectPolicy.exhausted(reconnectAttempts)) {
            exhausted = true;
            stopped = true;
            state = GatewayState.DISCONNECTED;
            log.error("[discord-gateway] giving up after {} reconnect attempts (last reason: {})",
                    reconnectAttempts - 1, reason);
            return;
        }

        transition(GatewayState.RECONNECTING);
        long delay = Backoff.compute(reconnectPolicy, reconnectAttempts);
        boolean tryResume = resume && sessionId != null;
        log.warn("[discord-gateway] {}; reconnect attempt {} in {}ms (resume={})",
                reason, reconnectAttempts, delay, tryResume);
        scheduler.schedule(() -> {
            synchronized (this) {
                if (!stopped && state == GatewayState.RECONNECTING) {
                    open(tryResume);
                }
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void closeConnection(int code, String reason) {
        GatewayTransport.Connection current = connection;
        connection = null;
        if (current == null) {
            return;
        }
        try {
            current.close(code, reason);
        } catch (RuntimeException e) {
            log.debug("[discord-gateway] close failed: {}", e.getMessage());
        }
    }

    private void transition(GatewayState next) {
        if (state == next) {
            return;
        }
        if (!state.canTransitionTo(next)) {
            log.warn("[discord-gateway] unexpected transition {} -> {}", state, next);
        }
        log.debug("[discord-gateway] {} -> {}", state, next);
        state = next;
    }

    private boolean send(int op, Object data) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("op", op);
        payload.set("d", mapper.valueToTree(data));
        GatewayTransport.Connection current = connection;
        return current != null && current.send(payload.toString());
    }

    // --- Heartbeat ---

    private void heartbeatTick() {
        synchronized (this) {
            if (stopped || connection == null) {
                return;
            }
            if (System.currentTimeMillis() - lastAckAt > heartbeatIntervalMs * 2) {
                reconnect("heartbeat ack timeout", true);
                return;
            }
            send(GatewayOpcodes.HEARTBEAT, sequence);
        }
    }

    // --- Inbound frames ---

    private final class GenerationListener implements GatewayTransport.Listener {
        private final int gen;

        GenerationListener(int gen) {
            this.gen = gen;
        }

        private boolean current() {
            return gen == generation.get();
        }

        @Override
        public void onOpen() {
            if (current()) {
                log.debug("[discord-gateway] socket open, waiting for HELLO");
            }
        }

        @Override
        public void onMessage(String text) {
            if (current()) {
                handleFrame(gen, text);
            }
        }

        @Override
        public void onClosed(int code, String reason) {
            if (current()) {
                handleClose(gen, code, reason);
            }
        }

        @Override
        public void onFailure(Throwable error) {
            if (current()) {
                handleClose(gen, -1, error.getMessage());
            }
        }
    }

    private void handleClose(int gen, int code, String reason) {
        synchronized (this) {
            if (gen != generation.get() || stopped) {
                return;
            }
            if (GatewayOpcodes.FATAL_CLOSE_CODES.contains(code)) {
                log.error("[discord-gateway] closed with fatal code {} ({}); not reconnecting", code, reason);
                heartbeat.stop();
                connection = null;
                stopped = true;
                exhausted = true;
                state = GatewayState.DISCONNECTED;
                return;
            }
            // a resume that never reached RESUMED falls back to a fresh IDENTIFY
            boolean resumeFailed = resuming && state != GatewayState.CONNECTED;
            reconnect("socket closed (" + code + (reason != null ? " " + reason : "") + ")", !resumeFailed);
        }
    }

    void handleFrame(int gen, String text) {
        JsonNode payload;
        try {
            payload = mapper.readTree(text);
        } catch (IOException e) {
            log.debug("[discord-gateway] unparseable frame: {}", e.getMessage());
            return;
        }

        int op = payload.path("op").asInt(-1);
        JsonNode data = payload.path("d");
        String dispatchType = null;

        synchronized (this) {
            if (gen != generation.get() || stopped) {
                return;
            }
            if (payload.hasNonNull("s")) {
                sequence = payload.get("s").asLong();
            }
            switch (op) {
                case GatewayOpcodes.HELLO -> onHello(data);
                case GatewayOpcodes.HEARTBEAT_ACK -> lastAckAt = System.currentTimeMillis();
                case GatewayOpcodes.HEARTBEAT -> send(GatewayOpcodes.HEARTBEAT, sequence);
                case GatewayOpcodes.RECONNECT -> reconnect("server requested reconnect", true);
                case GatewayOpcodes.INVALID_SESSION -> onInvalidSession(data.asBoolean(false));
                case GatewayOpcodes.DISPATCH -> dispatchType = onDispatchControl(payload.path("t").asText(""), data);
                default -> log.debug("[discord-gateway] ignoring op {}", op);
            }
        }

        // operator events leave the lock before reaching the sink
        if (dispatchType != null) {
            dispatchToSink(dispatchType, data);
        }
    }

    private void onHello(JsonNode data) {
        heartbeatIntervalMs = data.path("heartbeat_interval").asLong(41_250);
        lastAckAt = System.currentTimeMillis();
        heartbeat.updateInterval(heartbeatIntervalMs);
        heartbeat.start();
        transition(GatewayState.IDENTIFYING);

        if (resuming && sessionId != null) {
            ObjectNode resume = mapper.createObjectNode();
            resume.put("token", botToken);
            resume.put("session_id", sessionId);
            if (sequence != null) {
                resume.put("seq", sequence);
            } else {
                resume.putNull("seq");
            }
            send(GatewayOpcodes.RESUME, resume);
        } else {
            resuming = false;
            send(GatewayOpcodes.IDENTIFY, identifyPayload());
        }
    }

    private ObjectNode identifyPayload() {
        ObjectNode identify = mapper.createObjectNode();
        identify.put("token", botToken);
        identify.put("intents", GatewayOpcodes.BRIDGE_INTENTS);
        ObjectNode properties = identify.putObject("properties");
        properties.put("os", System.getProperty("os.name", "linux").toLowerCase());
        properties.put("browser", "pocketping");
        properties.put("device", "pocketping");
        return identify;
    }

    private void onInvalidSession(boolean resumable) {
        if (!resumable) {
            sessionId = null;
            resumeUrl = null;
            sequence = null;
        }
        reconnect("invalid session (resumable=" + resumable + ")", resumable);
    }

    /**
     * Handle READY/RESUMED under the lock.
     *
     * @return the dispatch type when it carries an operator event, else null
     */
    private String onDispatchControl(String type, JsonNode data) {
        switch (type) {
            case "READY" -> {
                sessionId = data.path("session_id").asText(null);
                resumeUrl = data.path("resume_gateway_url").asText(null);
                resuming = false;
                reconnectAttempts = 0;
                transition(GatewayState.CONNECTED);
                log.info("[discord-gateway] connected as {}", data.path("user").path("username").asText("bot"));
                return null;
            }
            case "RESUMED" -> {
                resuming = false;
                reconnectAttempts = 0;
                transition(GatewayState.CONNECTED);
                log.info("[discord-gateway] session resumed");
                return null;
            }
            case "MESSAGE_CREATE", "MESSAGE_UPDATE", "MESSAGE_DELETE" -> {
                return type;
            }
            default -> {
                return null;
            }
        }
    }

    private void dispatchToSink(String type, JsonNode data) {
        try {
            switch (type) {
                case "MESSAGE_CREATE" -> onMessageCreate(data);
                case "MESSAGE_UPDATE" -> onMessageUpdate(data);
                case "MESSAGE_DELETE" -> onMessageDelete(data);
                default -> log.debug("[discord-gateway] ignoring dispatch {}", type);
            }
        } catch (RuntimeException e) {
            log.error("[discord-gateway] failed to handle {}: {}", type, e.getMessage(), e);
        }
    }

    private boolean isFilteredBot(JsonNode author) {
        if (!author.path("bot").asBoolean(false)) {
            return false;
        }
        return !allowedBotIds.contains(author.path("id").asText(""));
    }

    private void onMessageCreate(JsonNode message) {
        JsonNode author = message.path("author");
        if (isFilteredBot(author)) {
            return;
        }
        String replyTo = message.path("message_reference").path("message_id").asText(null);
        sink.onOperatorMessage(OperatorEvents.OperatorMessage.builder()
                .sourceBridge(BridgeMessageIds.DISCORD)
                .sessionId(sessionResolver.apply(message.path("channel_id").asText()))
                .bridgeMessageId(message.path("id").asText())
                .content(message.path("content").asText(""))
                .operatorName(authorName(author))
                .attachments(attachments(message.path("attachments")))
                .replyToBridgeMessageId(replyTo)
                .build());
    }

    private void onMessageUpdate(JsonNode message) {
        JsonNode author = message.path("author");
        if (!author.isMissingNode() && isFilteredBot(author)) {
            return;
        }
        String content = message.path("content").asText("");
        if (content.isEmpty()) {
            // embed-only updates carry no content
            return;
        }
        sink.onOperatorMessageEdited(OperatorEvents.OperatorEdit.builder()
                .sourceBridge(BridgeMessageIds.DISCORD)
                .sessionId(sessionResolver.apply(message.path("channel_id").asText()))
                .bridgeMessageId(message.path("id").asText())
                .content(content)
                .editedAt(parseTimestamp(message.path("edited_timestamp").asText(null)))
                .build());
    }

    private void onMessageDelete(JsonNode message) {
        sink.onOperatorMessageDeleted(OperatorEvents.OperatorDelete.builder()
                .sourceBridge(BridgeMessageIds.DISCORD)
                .sessionId(sessionResolver.apply(message.path("channel_id").asText()))
                .bridgeMessageId(message.path("id").asText())
                .deletedAt(Instant.now())
                .build());
    }

    private static String authorName(JsonNode author) {
        String globalName = author.path("global_name").asText("");
        if (!globalName.isBlank()) {
            return globalName;
        }
        String username = author.path("username").asText("");
        return username.isBlank() ? "Operator" : username;
    }

    private static List<Attachment> attachments(JsonNode items) {
        List<Attachment> result = new ArrayList<>();
        for (JsonNode item : items) {
            result.add(Attachment.builder()
                    .id(item.path("id").asText())
                    .filename(item.path("filename").asText("file"))
                    .mimeType(item.path("content_type").asText("application/octet-stream"))
                    .size(item.path("size").asLong(0))
                    .url(item.path("url").asText(null))
                    .status("ready")
                    .uploadedFrom(BridgeMessageIds.DISCORD)
                    .bridgeFileId(item.path("id").asText())
                    .build());
        }
        return result;
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
