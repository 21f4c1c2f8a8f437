package com.pocketping.channel.discord.gateway;

/**
 * Resolves the entry endpoint of the gateway (GET /gateway/bot).
 */
@FunctionalInterface
public interface GatewayUrlResolver {

    String resolve() throws Exception;
}
