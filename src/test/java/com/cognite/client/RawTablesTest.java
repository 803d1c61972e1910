package com.cognite.client;

import com.cognite.client.config.ClientConfig;
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

class RawTablesTest {
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
    void listEncodesTheDatabaseName() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"name\":\"t1\"},{\"name\":\"t2\"}]}"));

        List<String> names = new ArrayList<>();
        client.raw().tables().list("my db/1").forEachRemaining(names::addAll);

        assertEquals(List.of("t1", "t2"), names);
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/projects/test/raw/dbs/my%20db%2F1/tables", request.getRequestUrl().encodedPath());
        assertNull(request.getRequestUrl().queryParameter("dbName"));
    }

    @Test
    void listStopsAtLimit() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"items\":[{\"name\":\"t1\"},{\"name\":\"t2\"}],\"nextCursor\":\"c1\"}"));

        List<String> names = new ArrayList<>();
        client.raw().tables().list("db", 2L).forEachRemaining(names::addAll);

        assertEquals(List.of("t1", "t2"), names);
        assertEquals("2", server.takeRequest().getRequestUrl().queryParameter("limit"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void createSendsEnsureParentAsQueryParameter() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"items\":[{\"name\":\"t1\"}]}"));

        client.raw().tables().create("db", List.of("t1"), true);

        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/projects/test/raw/dbs/db/tables", request.getRequestUrl().encodedPath());
        assertEquals("true", request.getRequestUrl().queryParameter("ensureParent"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertTrue(body.path("ensureParent").isMissingNode());
        assertTrue(body.path("dbName").isMissingNode());
        assertEquals("t1", body.path("items").get(0).path("name").textValue());
    }

    @Test
    void deletePostsTableNames() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        List<String> deleted = client.raw().tables().delete("db", List.of("t1", "t2"));

        assertEquals(List.of("t1", "t2"), deleted);
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v1/projects/test/raw/dbs/db/tables/delete", request.getRequestUrl().encodedPath());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(2, body.path("items").size());
    }
}
