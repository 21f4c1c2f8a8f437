package com.pocketping.gateway.registry;

import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.SenderType;
import com.pocketping.common.model.Session;
import com.pocketping.common.model.SessionMetadata;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class IdentityRegistryTest {

    private final IdentityRegistry registry = new IdentityRegistry(Duration.ofHours(1), 1000);

    @Test
    void merge_disjointPartials_orderDoesNotMatter() {
        IdentityRegistry other = new IdentityRegistry(Duration.ofHours(1), 1000);

        registry.merge("m1", BridgeMessageIds.telegram(50));
        registry.merge("m1", BridgeMessageIds.discord("d-1"));
        other.merge("m1", BridgeMessageIds.discord("d-1"));
        other.merge("m1", BridgeMessageIds.telegram(50));

        assertEquals(registry.get("m1").orElseThrow(), other.get("m1").orElseThrow());
    }

    @Test
    void merge_samePartialTwice_isIdempotent() {
        BridgeMessageIds first = registry.merge("m1", BridgeMessageIds.slack("1700.0001"));
        BridgeMessageIds second = registry.merge("m1", BridgeMessageIds.slack("1700.0001"));

        assertEquals(first, second);
        assertEquals("1700.0001", second.getSlackMessageTs());
    }

    @Test
    void merge_emptyFields_neverOverwrite() {
        registry.merge("m1", BridgeMessageIds.builder().telegramMessageId(50L).discordMessageId("d-1").build());
        registry.merge("m1", BridgeMessageIds.builder().telegramMessageId(0L).discordMessageId("").build());

        BridgeMessageIds ids = registry.get("m1").orElseThrow();
        assertEquals(50L, ids.getTelegramMessageId());
        assertEquals("d-1", ids.getDiscordMessageId());
    }

    @Test
    void merge_nullId_rejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.merge(null, BridgeMessageIds.telegram(1)));
    }

    @Test
    void merge_concurrentPlatforms_allSurvive() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 100; i++) {
                String id = "m" + i;
                futures.add(pool.submit(() -> awaitAndMerge(start, id, BridgeMessageIds.telegram(7))));
                futures.add(pool.submit(() -> awaitAndMerge(start, id, BridgeMessageIds.discord("d"))));
                futures.add(pool.submit(() -> awaitAndMerge(start, id, BridgeMessageIds.slack("s"))));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < 100; i++) {
            BridgeMessageIds ids = registry.get("m" + i).orElseThrow();
            assertEquals(7L, ids.getTelegramMessageId());
            assertEquals("d", ids.getDiscordMessageId());
            assertEquals("s", ids.getSlackMessageTs());
        }
    }

    private void awaitAndMerge(CountDownLatch start, String id, BridgeMessageIds partial) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        registry.merge(id, partial);
    }

    @Test
    void get_returnsCopy() {
        registry.merge("m1", BridgeMessageIds.telegram(50));

        registry.get("m1").orElseThrow().setTelegramMessageId(99L);

        assertEquals(50L, registry.get("m1").orElseThrow().getTelegramMessageId());
    }

    @Test
    void get_unknown_isEmpty() {
        assertTrue(registry.get("nope").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void findByPlatformId_indexesEveryMergedPlatform() {
        registry.merge("m1", BridgeMessageIds.telegram(50));
        registry.merge("m1", BridgeMessageIds.slack("1700.0001"));

        assertEquals("m1", registry.findByPlatformId("telegram", "50").orElseThrow());
        assertEquals("m1", registry.findByPlatformId("slack", "1700.0001").orElseThrow());
        assertTrue(registry.findByPlatformId("discord", "50").isEmpty());
    }

    @Test
    void updateMessage_cached_appliesMutation() {
        registry.cacheMessage(Message.builder().id("m1").sessionId("s1").content("hello")
                .sender(SenderType.VISITOR).build());

        Message updated = registry.updateMessage("m1", m -> m.setContent("hi")).orElseThrow();

        assertEquals("hi", updated.getContent());
        assertEquals("hi", registry.getMessage("m1").orElseThrow().getContent());
    }

    @Test
    void updateMessage_unknown_isNoOp() {
        assertTrue(registry.updateMessage("missing", m -> m.setContent("x")).isEmpty());
        assertTrue(registry.getMessage("missing").isEmpty());
    }

    @Test
    void cacheMessage_storesCopy() {
        Message original = Message.builder().id("m1").content("hello").build();
        registry.cacheMessage(original);

        original.setContent("changed");

        assertEquals("hello", registry.getMessage("m1").orElseThrow().getContent());
        assertEquals(1, registry.messageCount());
    }

    @Test
    void rememberSession_keepsServerMetadataAcrossSnapshots() {
        registry.rememberSession(Session.builder().id("s1").visitorId("v1")
                .metadata(SessionMetadata.builder().ip("1.2.3.4").country("FR").build()).build());

        Session merged = registry.rememberSession(Session.builder().id("s1")
                .metadata(SessionMetadata.builder().url("https://shop.test/cart").country("").build()).build());

        assertEquals("v1", merged.getVisitorId());
        assertEquals("1.2.3.4", merged.getMetadata().getIp());
        assertEquals("FR", merged.getMetadata().getCountry());
        assertEquals("https://shop.test/cart", merged.getMetadata().getUrl());
        assertEquals(merged, registry.getSession("s1").orElseThrow());
    }

    @Test
    void expiry_idleEntriesEvicted() throws Exception {
        IdentityRegistry shortLived = new IdentityRegistry(Duration.ofMillis(50), 1000);
        shortLived.merge("m1", BridgeMessageIds.telegram(50));

        Thread.sleep(200);

        assertTrue(shortLived.get("m1").isEmpty());
    }
}
