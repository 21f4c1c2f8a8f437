package com.pocketping.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.channel.adapter.BridgeAdapter;
import com.pocketping.channel.adapter.BridgeApiException;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.model.Attachment;
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
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramBridgeAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private TelegramBridgeAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        BridgeConfig.TelegramConfig config = new BridgeConfig.TelegramConfig();
        config.setBotToken("TOKEN");
        config.setChatId("-100123");
        String base = server.url("/").toString().replaceAll("/$", "");
        adapter = new TelegramBridgeAdapter(config, new OkHttpClient(), base);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void onNewSession_createsTopicOnceAndAnnounces() throws Exception {
        server.enqueue(ok("{\"message_thread_id\":77}"));
        server.enqueue(ok("{\"message_id\":10}"));
        Session session = session("s1-abcdef-123");
        session.setMetadata(SessionMetadata.builder().url("https://shop.example/pricing").country("FR")
                .city("Paris").build());

        adapter.onNewSession(session).get(5, TimeUnit.SECONDS);
        adapter.onNewSession(session).get(5, TimeUnit.SECONDS);

        assertEquals(2, server.getRequestCount());
        RecordedRequest create = server.takeRequest();
        assertEquals("/botTOKEN/createForumTopic", create.getPath());
        JsonNode createBody = body(create);
        assertEquals("-100123", createBody.get("chat_id").asText());
        assertEquals("💬 s1-abcde • shop.example/pricing", createBody.get("name").asText());

        JsonNode announce = body(server.takeRequest());
        assertEquals(77, announce.get("message_thread_id").asLong());
        assertEquals("HTML", announce.get("parse_mode").asText());
        assertTrue(announce.get("text").asText().startsWith("🆕 <b>New chat session</b>"));
        assertTrue(announce.get("text").asText().contains("🌍 FR, Paris"));
        assertEquals("s1-abcdef-123", adapter.resolveSessionId("77"));
    }

    @Test
    void onVisitorMessage_repliesNativelyAndReturnsMessageId() throws Exception {
        adapter.registerThread("s1", "77");
        server.enqueue(ok("{\"message_id\":50}"));

        BridgeAdapter.ReplyContext reply = BridgeAdapter.ReplyContext.builder()
                .bridgeIds(BridgeMessageIds.telegram(40))
                .quote("> *Support*\n> hi")
                .build();
        BridgeMessageIds ids = adapter.onVisitorMessage(message("m1", "Hello <there>"), session("s1"), reply)
                .get(5, TimeUnit.SECONDS);

        assertEquals(50L, ids.getTelegramMessageId());
        JsonNode sent = body(server.takeRequest());
        assertEquals(40, sent.get("reply_to_message_id").asLong());
        assertEquals(77, sent.get("message_thread_id").asLong());
        assertEquals("💬 <b>v1</b>:\nHello &lt;there&gt;", sent.get("text").asText());
    }

    @Test
    void onVisitorMessage_withoutNativeTarget_rendersQuote() throws Exception {
        adapter.registerThread("s1", "77");
        server.enqueue(ok("{\"message_id\":51}"));

        BridgeAdapter.ReplyContext reply = BridgeAdapter.ReplyContext.builder().quote("Support: hi").build();
        adapter.onVisitorMessage(message("m2", "yes"), session("s1"), reply).get(5, TimeUnit.SECONDS);

        JsonNode sent = body(server.takeRequest());
        assertFalse(sent.has("reply_to_message_id"));
        assertTrue(sent.get("text").asText().startsWith("<i>Support: hi</i>\n"));
    }

    @Test
    void onOperatorMessage_fromTelegram_makesNoCall() throws Exception {
        adapter.onOperatorMessage(message("telegram:9", "hi"), session("s1"), "telegram", "Ann")
                .get(5, TimeUnit.SECONDS);

        assertEquals(0, server.getRequestCount());
    }

    @Test
    void onOperatorMessage_fromSlack_postsWithAttachmentLinks() throws Exception {
        adapter.registerThread("s1", "77");
        server.enqueue(ok("{\"message_id\":60}"));
        Message message = message("slack:1.2", "see file");
        message.setAttachments(List.of(Attachment.builder().filename("shot.png").mimeType("image/png")
                .url("https://files.example/shot.png").build()));

        adapter.onOperatorMessage(message, session("s1"), "slack", "Ann").get(5, TimeUnit.SECONDS);

        String text = body(server.takeRequest()).get("text").asText();
        assertEquals("👤 <b>Ann</b> (via slack):\nsee file\n\n🖼️ shot.png: https://files.example/shot.png", text);
    }

    @Test
    void onVisitorMessageEdited_editsStoredMessageId() throws Exception {
        server.enqueue(ok("true"));

        BridgeMessageIds result = adapter.onVisitorMessageEdited("s1", "m1", "Hello there",
                BridgeMessageIds.telegram(50)).get(5, TimeUnit.SECONDS);

        RecordedRequest edit = server.takeRequest();
        assertEquals("/botTOKEN/editMessageText", edit.getPath());
        JsonNode body = body(edit);
        assertEquals(50, body.get("message_id").asLong());
        assertEquals("✏️ (edited):\nHello there", body.get("text").asText());
        assertEquals(50L, result.getTelegramMessageId());
    }

    @Test
    void onVisitorMessageEdited_withoutTelegramId_isNoop() throws Exception {
        BridgeMessageIds result = adapter.onVisitorMessageEdited("s1", "m1", "x", BridgeMessageIds.slack("1.1"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void onVisitorMessageDeleted_deletesStoredMessage() throws Exception {
        server.enqueue(ok("true"));

        adapter.onVisitorMessageDeleted("s1", "m1", BridgeMessageIds.telegram(50)).get(5, TimeUnit.SECONDS);

        RecordedRequest delete = server.takeRequest();
        assertEquals("/botTOKEN/deleteMessage", delete.getPath());
        assertEquals(50, body(delete).get("message_id").asLong());
    }

    @Test
    void apiError_completesWithBridgeApiException() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"ok\":false,\"description\":\"Bad Request: chat not found\"}"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.onNewSession(session("s2")).get(5, TimeUnit.SECONDS));

        BridgeApiException cause = assertInstanceOf(BridgeApiException.class, error.getCause());
        assertEquals(400, cause.getStatus());
        assertEquals("telegram", cause.getPlatform());
        assertTrue(cause.getMessage().contains("chat not found"));
    }

    @Test
    void failedTopicCreation_isRetriedOnNextCall() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{}"));
        server.enqueue(ok("{\"message_thread_id\":88}"));
        server.enqueue(ok("{\"message_id\":1}"));

        assertThrows(ExecutionException.class,
                () -> adapter.onNewSession(session("s3")).get(5, TimeUnit.SECONDS));
        adapter.onNewSession(session("s3")).get(5, TimeUnit.SECONDS);

        assertEquals(3, server.getRequestCount());
        assertEquals("s3", adapter.resolveSessionId("88"));
    }

    @Test
    void onVisitorDisconnect_withoutTopic_isNoop() throws Exception {
        adapter.onVisitorDisconnect(session("s9"), "👋 Visitor left (was here for 5s)").get(5, TimeUnit.SECONDS);

        assertEquals(0, server.getRequestCount());
    }

    // --- helpers ---

    private static MockResponse ok(String result) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true,\"result\":" + result + "}");
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
