package com.cognite.client;

import com.cognite.client.config.ClientConfig;
import com.cognite.client.dto.ClientCredentials;
import com.cognite.client.dto.CreatedSession;
import com.cognite.client.dto.Session;
import com.cognite.client.dto.SessionStatus;
import com.cognite.client.dto.SessionType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionsTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String CREATED_SESSION = "{\"items\":[{\"id\":42,\"type\":\"%s\",\"status\":\"READY\","
            + "\"nonce\":\"the-nonce\"%s}]}";

    private MockWebServer server;
    private CogniteClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = CogniteClient.ofToken("the-token")
                .withProject("test")
                .withBaseUrl(server.url("/").toString())
                .withClientConfig(ClientConfig.create().withMaxRetries(1));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void defaultSessionUsesTokenExchangeForTokenClients() throws Exception {
        server.enqueue(new MockResponse().setBody(String.format(CREATED_SESSION, "TOKEN_EXCHANGE", "")));

        CreatedSession session = client.sessions().create();

        assertEquals(42L, session.getId());
        assertEquals("the-nonce", session.getNonce());
        assertEquals("READY", session.getStatus());
        assertNull(session.getClientId());
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/projects/test/sessions", request.getRequestUrl().encodedPath());
        assertEquals("Bearer the-token", request.getHeader("Authorization"));
        JsonNode item = objectMapper.readTree(request.getBody().readUtf8()).path("items").get(0);
        assertTrue(item.path("tokenExchange").booleanValue());
    }

    @Test
    void clientCredentialsSession() throws Exception {
        server.enqueue(new MockResponse().setBody(
                String.format(CREATED_SESSION, "CLIENT_CREDENTIALS", ",\"clientId\":\"my-client\"")));

        CreatedSession session = client.sessions().create(ClientCredentials.of("my-client", "my-secret"));

        assertEquals("my-client", session.getClientId());
        JsonNode item = objectMapper.readTree(server.takeRequest().getBody().readUtf8()).path("items").get(0);
        assertEquals("my-client", item.path("clientId").textValue());
        assertEquals("my-secret", item.path("clientSecret").textValue());
    }

    @Test
    void oneshotTokenExchangeSession() throws Exception {
        server.enqueue(new MockResponse().setBody(String.format(CREATED_SESSION, "ONESHOT_TOKEN_EXCHANGE", "")));

        client.sessions().create(SessionType.ONESHOT_TOKEN_EXCHANGE);

        JsonNode item = objectMapper.readTree(server.takeRequest().getBody().readUtf8()).path("items").get(0);
        assertTrue(item.path("oneshotTokenExchange").booleanValue());
    }

    @Test
    void clientCredentialsSessionRequiresCredentials() {
        assertThrows(IllegalArgumentException.class,
                () -> client.sessions().create(SessionType.CLIENT_CREDENTIALS));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void listFiltersOnStatus() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"id\":1,\"type\":\"TOKEN_EXCHANGE\","
                + "\"status\":\"ACTIVE\",\"creationTime\":1000,\"expirationTime\":2000}]}"));

        List<Session> sessions = new ArrayList<>();
        client.sessions().list(SessionStatus.ACTIVE).forEachRemaining(sessions::addAll);

        assertEquals(1, sessions.size());
        assertEquals(1L, sessions.get(0).getId());
        assertEquals(1000L, sessions.get(0).getCreationTime());
        assertEquals("ACTIVE", server.takeRequest().getRequestUrl().queryParameter("status"));
    }

    @Test
    void retrieveById() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"id\":7,\"type\":\"CLIENT_CREDENTIALS\","
                + "\"status\":\"READY\",\"clientId\":\"abc\"}]}"));

        List<Session> sessions = client.sessions().retrieve(List.of(7L));

        assertEquals("abc", sessions.get(0).getClientId());
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/projects/test/sessions/byids", request.getRequestUrl().encodedPath());
        assertEquals(7L, objectMapper.readTree(request.getBody().readUtf8())
                .path("items").get(0).path("id").longValue());
    }

    @Test
    void revokeReturnsRevokedSessions() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"id\":7,\"type\":\"TOKEN_EXCHANGE\","
                + "\"status\":\"REVOKED\"},{\"id\":8,\"type\":\"TOKEN_EXCHANGE\",\"status\":\"REVOKED\"}]}"));

        List<Session> revoked = client.sessions().revoke(List.of(7L, 8L));

        assertEquals(2, revoked.size());
        assertEquals("REVOKED", revoked.get(1).getStatus());
        assertEquals("/api/v1/projects/test/sessions/revoke",
                server.takeRequest().getRequestUrl().encodedPath());
    }
}
