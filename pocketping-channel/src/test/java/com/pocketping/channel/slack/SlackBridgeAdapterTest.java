package com.pocketping.channel.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.channel.adapter.BridgeApiException;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.SenderType;
import com.pocketping.common.model.Session;
import com.pocketping.common.model.SessionMetadata;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SlackBridgeAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        base = server.url("/").toString().replaceAll("/$", "");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void onNewSession_botMode_parentMessageBecomesThread() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();
        server.enqueue(json("{\"ok\":true,\"ts\":\"1700000000.000100\"}"));
        Session session = session("s1");
        session.setMetadata(SessionMetadata.builder().url("https://shop.example/a&b").build());

        adapter.onNewSession(session).get(5, TimeUnit.SECONDS);

        RecordedRequest post = server.takeRequest();
        assertEquals("/chat.postMessage", post.getPath());
        assertEquals("Bearer xoxb-1", post.getHeader("Authorization"));
        JsonNode body = body(post);
        assertEquals("C1", body.get("channel").asText());
        assertEquals("New chat session from v1", body.get("text").asText());
        assertEquals("header", body.get("blocks").get(0).get("type").asText());
        assertEquals("*Page:* https://shop.example/a&amp;b",
                body.get("blocks").get(2).get("text").get("text").asText());
        assertFalse(body.has("thread_ts"));
        assertEquals("s1", adapter.resolveSessionId("1700000000.000100"));
    }

    @Test
    void onVisitorMessage_botMode_postsInThreadAndReturnsTs() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();
        adapter.registerThread("s1", "1700000000.000100");
        server.enqueue(json("{\"ok\":true,\"ts\":\"1700000001.000200\"}"));

        BridgeMessageIds ids = adapter.onVisitorMessage(message("m1", "a < b"), session("s1"), null)
                .get(5, TimeUnit.SECONDS);

        JsonNode body = body(server.takeRequest());
        assertEquals("1700000000.000100", body.get("thread_ts").asText());
        assertEquals("*v1*: a &lt; b", body.get("text").asText());
        assertEquals("1700000001.000200", ids.getSlackMessageTs());
    }

    @Test
    void onVisitorMessageEdited_botMode_callsChatUpdate() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();
        server.enqueue(json("{\"ok\":true}"));

        adapter.onVisitorMessageEdited("s1", "m1", "Hello there", BridgeMessageIds.slack("1.2"))
                .get(5, TimeUnit.SECONDS);

        RecordedRequest update = server.takeRequest();
        assertEquals("/chat.update", update.getPath());
        JsonNode body = body(update);
        assertEquals("1.2", body.get("ts").asText());
        assertEquals("_(edited)_ Hello there", body.get("text").asText());
    }

    @Test
    void okFalse_completesWithBridgeApiException() {
        SlackBridgeAdapter adapter = botAdapter();
        server.enqueue(json("{\"ok\":false,\"error\":\"channel_not_found\"}"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.onNewSession(session("s1")).get(5, TimeUnit.SECONDS));

        BridgeApiException cause = assertInstanceOf(BridgeApiException.class, error.getCause());
        assertTrue(cause.getMessage().contains("channel_not_found"));
    }

    @Test
    void lookupUserName_prefersRealName() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();
        server.enqueue(json("{\"ok\":true,\"user\":{\"name\":\"ann\",\"real_name\":\"Ann Smith\"}}"));
        server.enqueue(json("{\"ok\":true,\"user\":{\"name\":\"bob\"}}"));

        assertEquals("Ann Smith", adapter.lookupUserName("U1").get(5, TimeUnit.SECONDS));
        assertEquals("bob", adapter.lookupUserName("U2").get(5, TimeUnit.SECONDS));
        assertEquals("/users.info?user=U1", server.takeRequest().getPath());
    }

    @Test
    void lookupUserName_encodesUserId() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();
        server.enqueue(json("{\"ok\":true,\"user\":{\"name\":\"eve\"}}"));

        assertEquals("eve", adapter.lookupUserName("U1&user=U2").get(5, TimeUnit.SECONDS));

        RecordedRequest request = server.takeRequest();
        assertEquals("/users.info?user=U1%26user%3DU2", request.getPath());
        assertEquals("U1&user=U2", request.getRequestUrl().queryParameter("user"));
    }

    @Test
    void webhookMode_expectsPlainOk() throws Exception {
        SlackBridgeAdapter adapter = webhookAdapter();
        server.enqueue(new MockResponse().setBody("ok"));

        BridgeMessageIds ids = adapter.onVisitorMessage(message("m1", "hi"), session("s1"), null)
                .get(5, TimeUnit.SECONDS);

        RecordedRequest post = server.takeRequest();
        assertEquals("/services/T/B/X", post.getPath());
        assertFalse(body(post).has("channel"));
        assertTrue(ids.isEmpty());
    }

    @Test
    void webhookMode_unexpectedReply_fails() {
        SlackBridgeAdapter adapter = webhookAdapter();
        server.enqueue(new MockResponse().setBody("invalid_payload"));

        assertThrows(ExecutionException.class,
                () -> adapter.onNewSession(session("s1")).get(5, TimeUnit.SECONDS));
    }

    @Test
    void webhookMode_editIsNoop() throws Exception {
        SlackBridgeAdapter adapter = webhookAdapter();

        BridgeMessageIds ids = adapter.onVisitorMessageEdited("s1", "m1", "x", BridgeMessageIds.slack("1.2"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(ids.isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void onOperatorMessage_fromSlack_makesNoCall() throws Exception {
        SlackBridgeAdapter adapter = botAdapter();

        adapter.onOperatorMessage(message("slack:1.1", "x"), session("s1"), "slack", "Ann")
                .get(5, TimeUnit.SECONDS);

        assertEquals(0, server.getRequestCount());
    }

    // --- helpers ---

    private SlackBridgeAdapter botAdapter() {
        BridgeConfig.SlackConfig config = new BridgeConfig.SlackConfig();
        config.setBotToken("xoxb-1");
        config.setChannelId("C1");
        return new SlackBridgeAdapter(config, new OkHttpClient(), base);
    }

    private SlackBridgeAdapter webhookAdapter() {
        BridgeConfig.SlackConfig config = new BridgeConfig.SlackConfig();
        config.setWebhookUrl(server.url("/services/T/B/X").toString());
        return new SlackBridgeAdapter(config, new OkHttpClient(), base);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private static JsonNode body(RecordedRequest request) throws Exception {
        return MAPPER.readTree(request.getBody().readUtf8());
    }

    private static Session session(String id) {
        return Session.builder().id(id).visitorId("v1").build();
    }

    private static Message message(String id, String content) {
        return Message.builder().id(id).sessionId("s1").content(content).sender(SenderType.VISITOR)
                .timestamp(Instant.now()).build();
    }
}
