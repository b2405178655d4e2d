package com.forumbot.channel.discord;

import com.forumbot.channel.forum.ChannelInfo;
import com.forumbot.channel.forum.ForumPlatformException.Failure;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DiscordRestClientTest {

    private MockWebServer server;
    private DiscordRestClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new DiscordRestClient(HttpClient.newHttpClient(), server.url("/api/v10/").toString(), "tok");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        return request;
    }

    @Nested
    class FetchChannel {
        @Test
        void publicThread_isThread() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200)
                    .setBody("{\"id\": \"123\", \"name\": \"Alice/1/11\", \"type\": 11, \"parent_id\": \"9\"}"));

            Optional<ChannelInfo> info = client.fetchChannel(123L);

            assertEquals(Optional.of(new ChannelInfo(123L, "Alice/1/11", true)), info);
            RecordedRequest request = takeRequest();
            assertEquals("GET", request.getMethod());
            assertEquals("/api/v10/channels/123", request.getPath());
            assertEquals("Bot tok", request.getHeader("Authorization"));
        }

        @Test
        void textChannel_isNotThread() {
            server.enqueue(new MockResponse().setResponseCode(200)
                    .setBody("{\"id\": \"124\", \"name\": \"general\", \"type\": 0}"));

            assertFalse(client.fetchChannel(124L).orElseThrow().thread());
        }

        @Test
        void unknownChannel_isEmpty() {
            server.enqueue(new MockResponse().setResponseCode(404)
                    .setBody("{\"message\": \"Unknown Channel\", \"code\": 10003}"));

            assertTrue(client.fetchChannel(125L).isEmpty());
        }

        @Test
        void missingAccess_throwsPermission() {
            server.enqueue(new MockResponse().setResponseCode(403)
                    .setBody("{\"message\": \"Missing Access\", \"code\": 50001}"));

            var error = assertThrows(DiscordApi.ApiError.class, () -> client.fetchChannel(126L));
            assertEquals(Failure.PERMISSION, error.getFailure());
            assertEquals(403, error.getStatus());
        }

        @Test
        void unreadablePayload_throwsUnknown() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>"));

            var error = assertThrows(DiscordApi.ApiError.class, () -> client.fetchChannel(127L));
            assertEquals(Failure.UNKNOWN, error.getFailure());
        }
    }

    @Nested
    class DeleteChannel {
        @Test
        void sendsDeleteWithEncodedReason() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\": \"123\", \"type\": 11}"));

            client.deleteChannel(123L, "Source message 1 deleted; auto-clean thread.");

            RecordedRequest request = takeRequest();
            assertEquals("DELETE", request.getMethod());
            assertEquals("/api/v10/channels/123", request.getPath());
            assertEquals("Source%20message%201%20deleted%3B%20auto-clean%20thread.",
                    request.getHeader(DiscordApi.AUDIT_LOG_REASON_HEADER));
        }

        @Test
        void alreadyDeleted_throwsNotFound() {
            server.enqueue(new MockResponse().setResponseCode(404)
                    .setBody("{\"message\": \"Unknown Channel\", \"code\": 10003}"));

            var error = assertThrows(DiscordApi.ApiError.class, () -> client.deleteChannel(123L, "gone"));
            assertTrue(error.isNotFound());
        }

        @Test
        void serverError_throwsTransport() {
            server.enqueue(new MockResponse().setResponseCode(502).setBody("Bad Gateway"));

            var error = assertThrows(DiscordApi.ApiError.class, () -> client.deleteChannel(123L, null));
            assertEquals(Failure.TRANSPORT, error.getFailure());
            assertEquals("HTTP 502: Bad Gateway", error.getMessage());
        }
    }

    @Test
    void unreachableServer_throwsTransportWithoutStatus() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String base = stopped.url("/api/v10").toString();
        stopped.shutdown();
        DiscordRestClient offline = new DiscordRestClient(HttpClient.newHttpClient(), base, "tok");

        var error = assertThrows(DiscordApi.ApiError.class, () -> offline.fetchChannel(1L));
        assertEquals(Failure.TRANSPORT, error.getFailure());
        assertEquals(0, error.getStatus());
    }
}
