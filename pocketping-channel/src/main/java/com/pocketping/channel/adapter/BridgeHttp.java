package com.pocketping.channel.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous JSON-over-HTTP calls for one platform. Each call is enqueued on
 * OkHttp's dispatcher and completes a {@link CompletableFuture}; non-2xx
 * responses complete it with a {@link BridgeApiException}.
 */
@Slf4j
public class BridgeHttp {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final String platform;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public BridgeHttp(String platform, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.platform = platform;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public CompletableFuture<JsonNode> post(String url, Map<String, String> headers, Object body) {
        return send("POST", url, headers, body).thenApply(this::parse);
    }

    public CompletableFuture<JsonNode> patch(String url, Map<String, String> headers, Object body) {
        return send("PATCH", url, headers, body).thenApply(this::parse);
    }

    public CompletableFuture<JsonNode> delete(String url, Map<String, String> headers) {
        return send("DELETE", url, headers, null).thenApply(this::parse);
    }

    public CompletableFuture<JsonNode> get(String url, Map<String, String> headers) {
        return send("GET", url, headers, null).thenApply(this::parse);
    }

    /** POST and return the raw response text (webhooks that answer "ok"). */
    public CompletableFuture<String> postForText(String url, Map<String, String> headers, Object body) {
        return send("POST", url, headers, body);
    }

    /** Release the dispatcher threads and pooled connections. */
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private CompletableFuture<String> send(String method, String url, Map<String, String> headers, Object body) {
        CompletableFuture<String> future = new CompletableFuture<>();

        try {
            RequestBody requestBody = body == null ? null
                    : RequestBody.create(objectMapper.writeValueAsString(body), JSON);
            Request.Builder builder = new Request.Builder()
                    .url(url)
                    .method(method, requestBody);
            if (headers != null) {
                headers.forEach(builder::header);
            }

            httpClient.newCall(builder.build()).enqueue(new Callback() {
                @Override
                public void onFailure(Call call, IOException e) {
                    future.completeExceptionally(new BridgeApiException(platform, e.getMessage(), e));
                }

                @Override
                public void onResponse(Call call, Response response) throws IOException {
                    try (ResponseBody responseBody = response.body()) {
                        String text = responseBody != null ? responseBody.string() : "";
                        if (!response.isSuccessful()) {
                            future.completeExceptionally(
                                    new BridgeApiException(platform, response.code(), describe(text)));
                        } else {
                            future.complete(text);
                        }
                    }
                }
            });
        } catch (Exception e) {
            future.completeExceptionally(new BridgeApiException(platform, e.getMessage(), e));
        }

        return future;
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new BridgeApiException(platform, 0, "unparseable response: " + abbreviate(text));
        }
    }

    /**
     * Pull a readable error out of a platform error body
     * ({@code description}, {@code error} or {@code message}).
     */
    private String describe(String text) {
        if (text == null || text.isBlank()) {
            return "empty response";
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (IOException e) {
            return abbreviate(text);
        }
        for (String field : new String[] { "description", "error", "message" }) {
            if (node.hasNonNull(field)) {
                return node.get(field).asText();
            }
        }
        return abbreviate(text);
    }

    private static String abbreviate(String text) {
        String single = text.replaceAll("\\s+", " ").trim();
        return single.length() <= 200 ? single : single.substring(0, 200) + "…";
    }
}
