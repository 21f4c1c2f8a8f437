package com.pocketping.gateway.router;

import com.pocketping.common.infra.FormatDuration;
import com.pocketping.common.model.Session;

/**
 * Operator-facing notice posted when a visitor leaves.
 */
public final class DisconnectText {

    private DisconnectText() {
    }

    /** "👋 Alice left (was here for 1h 15min)". */
    public static String format(Session session, long durationSeconds) {
        String name = session != null ? session.displayName() : "Visitor";
        return "👋 " + name + " left (was here for " + FormatDuration.formatVisit(durationSeconds) + ")";
    }
}
