package com.pocketping.channel.registry;

import com.pocketping.channel.adapter.StubBridgeAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BridgeRegistryTest {

    @Test
    void listAll_ordersByPlatform() {
        BridgeRegistry registry = new BridgeRegistry();
        registry.register(new StubBridgeAdapter("slack"));
        registry.register(new StubBridgeAdapter("telegram"));
        registry.register(new StubBridgeAdapter("discord"));

        assertEquals(List.of("telegram", "discord", "slack"), registry.names());
    }

    @Test
    void get_resolvesAliases() {
        BridgeRegistry registry = new BridgeRegistry();
        StubBridgeAdapter telegram = new StubBridgeAdapter("telegram");
        registry.register(telegram);

        assertSame(telegram, registry.get("TG").orElseThrow());
        assertSame(telegram, registry.get("telegram", StubBridgeAdapter.class).orElseThrow());
        assertTrue(registry.get("slack").isEmpty());
        assertEquals("Discord", registry.meta("dc").orElseThrow().getName());
    }

    @Test
    void register_sameName_closesPrevious() {
        BridgeRegistry registry = new BridgeRegistry();
        StubBridgeAdapter first = new StubBridgeAdapter("discord");
        StubBridgeAdapter second = new StubBridgeAdapter("discord");

        registry.register(first);
        registry.register(second);

        assertTrue(first.closed);
        assertFalse(second.closed);
        assertSame(second, registry.get("discord").orElseThrow());
    }

    @Test
    void closeAll_closesAndEmpties() {
        BridgeRegistry registry = new BridgeRegistry();
        StubBridgeAdapter slack = new StubBridgeAdapter("slack");
        registry.register(slack);

        registry.closeAll();

        assertTrue(slack.closed);
        assertTrue(registry.isEmpty());
    }

    @Test
    void unregister_byAlias() {
        BridgeRegistry registry = new BridgeRegistry();
        StubBridgeAdapter telegram = new StubBridgeAdapter("telegram");
        registry.register(telegram);

        registry.unregister("tg");

        assertTrue(telegram.closed);
        assertTrue(registry.isEmpty());
    }
}
