package com.cognite.client;

import com.cognite.client.config.ClientConfig;
import com.cognite.client.exception.CogniteCompoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RawDatabasesTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private CogniteClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = CogniteClient.ofKey("test-key")
                .withProject("test")
                .withBaseUrl(server.url("/").toString())
                .withClientConfig(ClientConfig.create().withMaxRetries(1));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void listFollowsCursors() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"items\":[{\"name\":\"db1\"},{\"name\":\"db2\"}],\"nextCursor\":\"next\"}"));
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"name\":\"db3\"}]}"));

        List<String> names = new ArrayList<>();
        client.raw().databases().list().forEachRemaining(names::addAll);

        assertEquals(List.of("db1", "db2", "db3"), names);
        RecordedRequest first = server.takeRequest();
        assertEquals("/api/v1/projects/test/raw/dbs", first.getRequestUrl().encodedPath());
        assertNull(first.getRequestUrl().queryParameter("cursor"));
        assertEquals("next", server.takeRequest().getRequestUrl().queryParameter("cursor"));
    }

    @Test
    void listStopsAtLimit() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"items\":[{\"name\":\"db1\"},{\"name\":\"db2\"}],\"nextCursor\":\"c1\"}"));
        server.enqueue(new MockResponse().setBody(
                "{\"items\":[{\"name\":\"db3\"}],\"nextCursor\":\"c2\"}"));

        List<String> names = new ArrayList<>();
        client.raw().databases().list(3L).forEachRemaining(names::addAll);

        assertEquals(List.of("db1", "db2", "db3"), names);
        assertEquals("3", server.takeRequest().getRequestUrl().queryParameter("limit"));
        assertEquals("1", server.takeRequest().getRequestUrl().queryParameter("limit"));
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void listRejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> client.raw().databases().list(-1L));
    }

    @Test
    void createPostsNames() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"name\":\"db1\"}]}"));

        List<String> created = client.raw().databases().create(List.of("db1"));

        assertEquals(List.of("db1"), created);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("db1", body.path("items").get(0).path("name").textValue());
    }

    @Test
    void createRaisesOnRejectedRequest() {
        server.enqueue(new MockResponse().setResponseCode(409).setBody(
                "{\"error\":{\"code\":409,\"message\":\"Databases already created\","
                        + "\"duplicated\":[{\"name\":\"db1\"}]}}"));

        assertThrows(Exception.class, () -> client.raw().databases().create(List.of("db1")));
    }

    @Test
    void deleteBatchesAndSendsRecursiveFlag() throws Exception {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 1500; i++) {
            names.add("db" + i);
        }
        server.enqueue(new MockResponse().setBody("{}"));
        server.enqueue(new MockResponse().setBody("{}"));

        List<String> deleted = client.raw().databases().delete(names, true);

        assertEquals(names, deleted);
        Set<String> deletedNames = new HashSet<>();
        for (int i = 0; i < 2; i++) {
            RecordedRequest request = server.takeRequest();
            assertEquals("/api/v1/projects/test/raw/dbs/delete", request.getRequestUrl().encodedPath());
            JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
            assertTrue(body.path("recursive").booleanValue());
            body.path("items").forEach(item -> deletedNames.add(item.path("name").textValue()));
        }
        assertEquals(new HashSet<>(names), deletedNames);
    }

    @Test
    void deleteReportsNotFoundDatabases() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody(
                "{\"error\":{\"code\":400,\"message\":\"Databases not found\","
                        + "\"missing\":[{\"name\":\"db1\"}]}}"));

        CogniteCompoundException exception = assertThrows(CogniteCompoundException.class,
                () -> client.raw().databases().delete(List.of("db1")));
        assertEquals(List.of("db1"), exception.getFailed());
        assertTrue(exception.getSuccessful().isEmpty());
    }
}
