package com.parley.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.EventKind;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.discord.DiscordTypes.MessageHandle;
import com.parley.channel.discord.DiscordTypes.ThreadRef;
import com.parley.common.config.ParleyConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link DiscordPlatform} over the Discord REST API (v10).
 * <p>
 * Outbound messages only allow user mentions and suppress link embeds.
 */
@Slf4j
public class DiscordRestClient implements DiscordPlatform {

    static final int SUPPRESS_EMBEDS_FLAG = 1 << 2;
    static final int PUBLIC_THREAD_TYPE = 11;
    private static final Set<Integer> THREAD_TYPES = Set.of(10, 11, 12);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String token;
    private final String apiBaseUrl;
    private final Duration requestTimeout;
    private final int autoArchiveMinutes;

    public DiscordRestClient(ParleyConfig config) {
        this(config.getDiscord().getToken(),
                config.getDiscord().getApiBaseUrl(),
                Duration.ofMillis(config.getDiscord().getRequestTimeoutMs()),
                config.getThreads().getAutoArchiveMinutes(),
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build());
    }

    public DiscordRestClient(String token, String apiBaseUrl, Duration requestTimeout,
            int autoArchiveMinutes, HttpClient httpClient) {
        if (token == null || token.isBlank()) {
            log.warn("Discord REST client created without a bot token; API calls will be rejected");
        }
        this.token = token;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.requestTimeout = requestTimeout;
        this.autoArchiveMinutes = autoArchiveMinutes;
        this.httpClient = httpClient;
    }

    // =========================================================================
    // DiscordPlatform
    // =========================================================================

    @Override
    public CompletableFuture<MessageHandle> sendMessage(String channelId, String content,
            List<Attachment> attachments) {
        ObjectNode payload = messagePayload(content);
        HttpRequest request;
        if (attachments == null || attachments.isEmpty()) {
            request = jsonRequest("/channels/" + channelId + "/messages", "POST", payload);
        } else {
            ArrayNode meta = payload.putArray("attachments");
            for (int i = 0; i < attachments.size(); i++) {
                meta.addObject().put("id", i).put("filename", attachments.get(i).filename());
            }
            request = multipartRequest("/channels/" + channelId + "/messages", payload, attachments);
        }
        return call("send message", request)
                .thenApply(node -> new MessageHandle(
                        node.path("channel_id").asText(channelId), node.path("id").asText()));
    }

    @Override
    public CompletableFuture<ThreadRef> createThread(InboundEvent event, String name) {
        ObjectNode body = objectMapper.createObjectNode()
                .put("name", name)
                .put("auto_archive_duration", autoArchiveMinutes);
        String path;
        if (event.kind() == EventKind.SLASH_COMMAND) {
            // interactions have no message to start from: open a standalone thread
            body.put("type", PUBLIC_THREAD_TYPE);
            path = "/channels/" + event.channelId() + "/threads";
        } else {
            path = "/channels/" + event.channelId() + "/messages/" + event.eventId() + "/threads";
        }
        return call("create thread", jsonRequest(path, "POST", body))
                .thenApply(node -> new ThreadRef(node.path("id").asText(), node.path("name").asText(name)))
                .exceptionally(err -> {
                    Throwable cause = DiscordTransportErrors.unwrap(err);
                    if (cause instanceof DiscordApiException api) {
                        throw ThreadCreateException.from(api);
                    }
                    throw new CompletionException(cause);
                });
    }

    @Override
    public CompletableFuture<Optional<ThreadRef>> fetchExistingThread(InboundEvent event) {
        if (event.kind() == EventKind.SLASH_COMMAND) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        // a thread started from a message shares the message's id
        HttpRequest request = baseRequest("/channels/" + event.eventId()).GET().build();
        return call("fetch thread", request)
                .thenApply(node -> {
                    if (!THREAD_TYPES.contains(node.path("type").asInt(-1))) {
                        return Optional.<ThreadRef>empty();
                    }
                    return Optional.of(new ThreadRef(node.path("id").asText(), node.path("name").asText()));
                })
                .exceptionally(err -> {
                    Throwable cause = DiscordTransportErrors.unwrap(err);
                    if (cause instanceof DiscordApiException api && api.isNotFound()) {
                        return Optional.empty();
                    }
                    throw new CompletionException(cause);
                });
    }

    @Override
    public CompletableFuture<Void> deleteMessage(MessageHandle handle) {
        HttpRequest request = baseRequest("/channels/" + handle.channelId() + "/messages/" + handle.messageId())
                .DELETE()
                .build();
        return call("delete message", request)
                .<Void>thenApply(node -> null)
                .exceptionally(err -> {
                    Throwable cause = DiscordTransportErrors.unwrap(err);
                    if (cause instanceof DiscordApiException api && api.isNotFound()) {
                        log.debug("Message {} already gone", handle.messageId());
                        return null;
                    }
                    throw new CompletionException(cause);
                });
    }

    // =========================================================================
    // Request plumbing
    // =========================================================================

    ObjectNode messagePayload(String content) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("content", content);
        payload.putObject("allowed_mentions").putArray("parse").add("users");
        payload.put("flags", SUPPRESS_EMBEDS_FLAG);
        return payload;
    }

    private HttpRequest.Builder baseRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bot " + token)
                .header("User-Agent", "DiscordBot (https://github.com/parley, 0.1)");
    }

    private HttpRequest jsonRequest(String path, String method, JsonNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baseRequest(path)
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private HttpRequest multipartRequest(String path, JsonNode payload, List<Attachment> attachments) {
        String boundary = "----ParleyBoundary" + System.nanoTime();
        try {
            var baos = new ByteArrayOutputStream();

            baos.write(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
            baos.write("Content-Disposition: form-data; name=\"payload_json\"\r\n".getBytes(StandardCharsets.UTF_8));
            baos.write("Content-Type: application/json\r\n\r\n".getBytes(StandardCharsets.UTF_8));
            baos.write(objectMapper.writeValueAsBytes(payload));
            baos.write("\r\n".getBytes(StandardCharsets.UTF_8));

            for (int i = 0; i < attachments.size(); i++) {
                Attachment file = attachments.get(i);
                String contentType = file.contentType() != null ? file.contentType() : "application/octet-stream";
                baos.write(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
                baos.write(("Content-Disposition: form-data; name=\"files[" + i + "]\"; filename=\""
                        + file.filename() + "\"\r\n").getBytes(StandardCharsets.UTF_8));
                baos.write(("Content-Type: " + contentType + "\r\n\r\n").getBytes(StandardCharsets.UTF_8));
                baos.write(file.data());
                baos.write("\r\n".getBytes(StandardCharsets.UTF_8));
            }
            baos.write(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

            return baseRequest(path)
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(baos.toByteArray()))
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private CompletableFuture<JsonNode> call(String operation, HttpRequest request) {
        log.debug("Discord {} -> {} {}", operation, request.method(), request.uri().getPath());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        throw DiscordApiException.fromResponse(operation, status, response.body());
                    }
                    return parseBody(response.body());
                });
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
