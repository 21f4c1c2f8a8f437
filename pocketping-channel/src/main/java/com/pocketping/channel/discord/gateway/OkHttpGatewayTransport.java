package com.pocketping.channel.discord.gateway;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.TimeUnit;

/**
 * {@link GatewayTransport} over OkHttp WebSockets.
 */
@Slf4j
public class OkHttpGatewayTransport implements GatewayTransport {

    private final OkHttpClient client;

    public OkHttpGatewayTransport() {
        this(new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: liveness is checked by heartbeats
                .build());
    }

    public OkHttpGatewayTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public Connection connect(String url, Listener listener) {
        WebSocket socket = client.newWebSocket(new Request.Builder().url(url).build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                listener.onOpen();
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                listener.onMessage(text);
            }

            @Override
            public void onClosing(WebSocket ws, int code, String reason) {
                ws.close(code, null);
            }

            @Override
            public void onClosed(WebSocket ws, int code, String reason) {
                listener.onClosed(code, reason);
            }

            @Override
            public void onFailure(WebSocket ws, Throwable t, Response response) {
                listener.onFailure(t);
            }
        });

        return new Connection() {
            @Override
            public boolean send(String text) {
                return socket.send(text);
            }

            @Override
            public void close(int code, String reason) {
                if (!socket.close(code, reason)) {
                    socket.cancel();
                }
            }
        };
    }
}
