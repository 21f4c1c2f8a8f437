package com.pocketping.channel;

import com.pocketping.channel.discord.DiscordInteractionHandler;
import com.pocketping.channel.slack.SlackEventsHandler;
import com.pocketping.channel.telegram.TelegramWebhookHandler;

import java.util.Optional;

/**
 * Webhook handlers of the enabled platforms. A missing handler means the
 * platform is not configured.
 */
public class InboundHandlers {

    private final TelegramWebhookHandler telegram;
    private final SlackEventsHandler slack;
    private final DiscordInteractionHandler discord;

    public InboundHandlers(TelegramWebhookHandler telegram, SlackEventsHandler slack,
            DiscordInteractionHandler discord) {
        this.telegram = telegram;
        this.slack = slack;
        this.discord = discord;
    }

    public Optional<TelegramWebhookHandler> telegram() {
        return Optional.ofNullable(telegram);
    }

    public Optional<SlackEventsHandler> slack() {
        return Optional.ofNullable(slack);
    }

    public Optional<DiscordInteractionHandler> discord() {
        return Optional.ofNullable(discord);
    }
}
