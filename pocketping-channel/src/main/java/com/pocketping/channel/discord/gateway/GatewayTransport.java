package com.pocketping.channel.discord.gateway;

/**
 * Socket abstraction under the gateway client. Production uses OkHttp
 * WebSockets; tests drive the state machine through a fake.
 */
public interface GatewayTransport {

    /**
     * Open a connection. Events for it are delivered to {@code listener},
     * possibly on another thread.
     */
    Connection connect(String url, Listener listener);

    interface Connection {

        /** Queue a text frame; false when the socket is already closed. */
        boolean send(String text);

        void close(int code, String reason);
    }

    interface Listener {

        void onOpen();

        void onMessage(String text);

        void onClosed(int code, String reason);

        void onFailure(Throwable error);
    }
}
