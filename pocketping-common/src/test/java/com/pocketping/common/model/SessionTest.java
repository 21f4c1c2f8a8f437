package com.pocketping.common.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    @Test
    void mergedWith_blankClientFields_keepServerValues() {
        Session existing = Session.builder().id("s1").visitorId("v1")
                .metadata(SessionMetadata.builder().ip("203.0.113.9").country("FR").url("/a").build())
                .build();
        Session reconnect = Session.builder().id("s1")
                .metadata(SessionMetadata.builder().ip("").url("/pricing").build())
                .build();

        Session merged = existing.mergedWith(reconnect);

        assertEquals("203.0.113.9", merged.getMetadata().getIp());
        assertEquals("FR", merged.getMetadata().getCountry());
        assertEquals("/pricing", merged.getMetadata().getUrl());
        assertEquals("v1", merged.getVisitorId());
    }

    @Test
    void mergedWith_absentFlags_keepPreviousValues() {
        Session existing = Session.builder().id("s1").operatorOnline(true).aiActive(true).build();

        Session partial = existing.mergedWith(Session.builder().id("s1").build());
        Session explicit = existing.mergedWith(Session.builder().id("s1").operatorOnline(false).build());

        assertEquals(Boolean.TRUE, partial.getOperatorOnline());
        assertEquals(Boolean.TRUE, partial.getAiActive());
        assertEquals(Boolean.FALSE, explicit.getOperatorOnline());
        assertEquals(Boolean.TRUE, explicit.getAiActive());
    }

    @Test
    void displayName_fallbackChain() {
        Session withIdentity = Session.builder().id("s")
                .identity(UserIdentity.builder().id("u").name("Ada").build()).build();
        Session withEmail = Session.builder().id("s")
                .identity(UserIdentity.builder().id("u").email("grace@example.com").build()).build();
        Session anonymous = Session.ofId("s");

        assertEquals("Ada", withIdentity.displayName());
        assertEquals("grace", withEmail.displayName());
        assertEquals("Visitor", anonymous.displayName());
    }
}
