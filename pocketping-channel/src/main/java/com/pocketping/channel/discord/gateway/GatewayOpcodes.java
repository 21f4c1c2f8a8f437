package com.pocketping.channel.discord.gateway;

import java.util.Set;

/**
 * Discord gateway opcodes, intents and close codes used by the bridge.
 */
public final class GatewayOpcodes {

    private GatewayOpcodes() {
    }

    public static final int DISPATCH = 0;
    public static final int HEARTBEAT = 1;
    public static final int IDENTIFY = 2;
    public static final int RESUME = 6;
    public static final int RECONNECT = 7;
    public static final int INVALID_SESSION = 9;
    public static final int HELLO = 10;
    public static final int HEARTBEAT_ACK = 11;

    public static final int INTENT_GUILDS = 1;
    public static final int INTENT_GUILD_MESSAGES = 1 << 9;
    public static final int INTENT_MESSAGE_CONTENT = 1 << 15;

    /** GUILDS | GUILD_MESSAGES | MESSAGE_CONTENT = 33281. */
    public static final int BRIDGE_INTENTS = INTENT_GUILDS | INTENT_GUILD_MESSAGES | INTENT_MESSAGE_CONTENT;

    public static final String GATEWAY_QUERY = "?v=10&encoding=json";

    /**
     * Close codes after which reconnecting cannot help: authentication
     * failed, invalid shard, sharding required, invalid API version,
     * invalid or disallowed intents.
     */
    public static final Set<Integer> FATAL_CLOSE_CODES = Set.of(4004, 4010, 4011, 4012, 4013, 4014);
}
