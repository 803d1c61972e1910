package com.cognite.client.config;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OAuthClientCredentialsTest {
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private OAuthClientCredentials credentials() {
        return OAuthClientCredentials.of("my-client", "my-secret", server.url("/oauth/token").toString(),
                List.of("https://api.cognitedata.com/.default"));
    }

    @Test
    void postsClientCredentialsGrant() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"token-1\",\"expires_in\":3600}"));

        assertEquals("Authorization", credentials().getHeaderName());
        assertEquals("Bearer token-1", credentials().getHeaderValue());

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        String form = request.getBody().readUtf8();
        assertTrue(form.contains("grant_type=client_credentials"));
        assertTrue(form.contains("client_id=my-client"));
        assertTrue(form.contains("client_secret=my-secret"));
        assertTrue(form.contains("scope="));
    }

    @Test
    void cachesTokenUntilExpiry() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"token-1\",\"expires_in\":3600}"));
        OAuthClientCredentials credentials = credentials();

        assertEquals("Bearer token-1", credentials.getHeaderValue());
        assertEquals("Bearer token-1", credentials.getHeaderValue());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void refreshesTokenWithinLeeway() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"token-1\",\"expires_in\":10}"));
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"token-2\",\"expires_in\":10}"));
        OAuthClientCredentials credentials = credentials().withTokenExpiryLeeway(Duration.ofSeconds(30));

        assertEquals("Bearer token-1", credentials.getHeaderValue());
        assertEquals("Bearer token-2", credentials.getHeaderValue());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void failedTokenRequestRaises() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid_client\"}"));

        Exception exception = assertThrows(Exception.class, () -> credentials().getHeaderValue());
        assertTrue(exception.getMessage().contains("401"));
    }

    @Test
    void rejectsMissingSecret() {
        assertThrows(IllegalArgumentException.class,
                () -> OAuthClientCredentials.of("my-client", "", "https://example.com/token", List.of()));
    }

    @Test
    void toStringHidesSecret() {
        assertFalse(credentials().toString().contains("my-secret"));
    }
}
