package com.forumbot.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forumbot.channel.forum.ChannelInfo;
import com.forumbot.channel.forum.ForumPlatformException.Failure;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Direct Discord REST calls for channels looked up by id. Used for threads the
 * gateway cache does not hold (archived, or created before a restart).
 */
@Slf4j
public class DiscordRestClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String apiBase;
    private final String token;
    private final ObjectMapper mapper = new ObjectMapper();

    public DiscordRestClient(String token) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(), DiscordApi.API_BASE, token);
    }

    public DiscordRestClient(HttpClient httpClient, String apiBase, String token) {
        this.httpClient = httpClient;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.token = token;
    }

    /**
     * GET /channels/{id}.
     *
     * @return empty when Discord reports the channel as unknown
     */
    public Optional<ChannelInfo> fetchChannel(long channelId) {
        HttpResponse<String> response = send(request(channelId).GET().build(), "fetch channel " + channelId);
        int status = response.statusCode();
        if (status / 100 != 2) {
            DiscordApi.ApiError error = DiscordApi.errorFromResponse(status, response.body());
            if (error.isNotFound())
                return Optional.empty();
            throw error;
        }
        try {
            JsonNode root = mapper.readTree(response.body());
            Integer type = root.path("type").isNumber() ? root.path("type").asInt() : null;
            return Optional.of(new ChannelInfo(
                    root.path("id").asLong(channelId),
                    root.path("name").asText(""),
                    DiscordThreading.isThreadType(type)));
        } catch (IOException e) {
            throw new DiscordApi.ApiError(Failure.UNKNOWN, status,
                    "Unreadable channel payload for " + channelId, e);
        }
    }

    /**
     * DELETE /channels/{id} with an audit-log reason.
     */
    public void deleteChannel(long channelId, String reason) {
        HttpRequest.Builder builder = request(channelId).DELETE();
        if (reason != null && !reason.isBlank()) {
            builder.header(DiscordApi.AUDIT_LOG_REASON_HEADER, encodeReason(reason));
        }
        HttpResponse<String> response = send(builder.build(), "delete channel " + channelId);
        if (response.statusCode() / 100 != 2) {
            throw DiscordApi.errorFromResponse(response.statusCode(), response.body());
        }
    }

    /** Percent-encode for the audit-log header (spaces as %20, not '+'). */
    static String encodeReason(String reason) {
        return URLEncoder.encode(reason, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder request(long channelId) {
        return HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/channels/" + channelId))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bot " + token)
                .header("User-Agent", "DiscordBot (forumbot, 0.1)");
    }

    private HttpResponse<String> send(HttpRequest request, String what) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DiscordApi.ApiError(Failure.TRANSPORT, 0, "Discord API call failed: " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscordApi.ApiError(Failure.TRANSPORT, 0, "Interrupted during Discord API call: " + what, e);
        }
    }
}
