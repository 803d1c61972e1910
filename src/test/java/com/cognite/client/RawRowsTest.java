package com.cognite.client;

import com.cognite.client.config.ClientConfig;
import com.cognite.client.config.ListConfig;
import com.cognite.client.dto.RawRow;
import com.cognite.client.exception.CogniteCompoundException;
import com.cognite.client.servicesV1.RequestParameters;
import com.cognite.client.util.DataGenerator;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RawRowsTest {
    final Logger LOG = LoggerFactory.getLogger(this.getClass());
    private static final String DB = "the_db";
    private static final String TABLE = "the_table";

    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (null != server) {
            server.shutdown();
        }
    }

    private CogniteClient startClient(FakeRawServer dispatcher) throws Exception {
        server = new MockWebServer();
        server.setDispatcher(dispatcher);
        server.start();
        return CogniteClient.ofKey("test-key")
                .withProject("test")
                .withBaseUrl(server.url("/").toString())
                .withClientConfig(ClientConfig.create()
                        .withMaxRetries(1)
                        .withBackpressureUnit(Duration.ofMillis(10)));
    }

    @Test
    void serialListReturnsChunksOfExactSize() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(2500);
        CogniteClient client = startClient(fakeServer);

        Iterator<List<RawRow>> iterator = client.raw().rows().list(DB, TABLE, RequestParameters.create(),
                ListConfig.create().withChunkSize(1000));
        List<Integer> chunkSizes = new ArrayList<>();
        List<RawRow> rows = new ArrayList<>();
        iterator.forEachRemaining(chunk -> {
            chunkSizes.add(chunk.size());
            rows.addAll(chunk);
        });

        assertEquals(List.of(1000, 1000, 500), chunkSizes);
        assertEquals("key-0", rows.get(0).getKey());
        assertEquals("key-2499", rows.get(2499).getKey());
        assertEquals(DB, rows.get(0).getDbName());
        assertEquals(TABLE, rows.get(0).getTableName());
        assertEquals(7, rows.get(7).getColumns().get("value"));
        assertEquals(1_600_000_000_007L, rows.get(7).getLastUpdatedTime());
        assertTrue(fakeServer.getRequests("/cursors").isEmpty());
        for (RecordedRequest request : fakeServer.getRequests("/rows")) {
            assertEquals("1000", request.getRequestUrl().queryParameter("limit"));
            assertEquals("test-key", request.getHeader("api-key"));
        }
    }

    @Test
    void serialListStopsAtLimit() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(25_000);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = new ArrayList<>();
        client.raw().rows().list(DB, TABLE, RequestParameters.create(), ListConfig.create().withLimit(12_345))
                .forEachRemaining(rows::addAll);

        assertEquals(12_345, rows.size());
        List<RecordedRequest> requests = fakeServer.getRequests("/rows");
        assertEquals(2, requests.size());
        assertEquals("10000", requests.get(0).getRequestUrl().queryParameter("limit"));
        assertEquals("2345", requests.get(1).getRequestUrl().queryParameter("limit"));
    }

    @Test
    void concurrentListReadsAllPartitions() throws Exception {
        Instant startInstant = Instant.now();
        FakeRawServer fakeServer = new FakeRawServer(12_000);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = new ArrayList<>();
        client.raw().rows().list(DB, TABLE, RequestParameters.create()
                        .withRootParameter("minLastUpdatedTime", 1_500_000_000_000L)
                        .withRootParameter("columns", List.of("value")),
                ListConfig.create().withPartitions(4).withChunkSize(1000))
                .forEachRemaining(chunk -> {
                    assertTrue(chunk.size() <= 1000);
                    rows.addAll(chunk);
                });
        LOG.info("Read {} rows concurrently. Duration: {}", rows.size(), Duration.between(startInstant, Instant.now()));

        assertEquals(12_000, rows.size());
        assertEquals(12_000, rows.stream().map(RawRow::getKey).collect(Collectors.toSet()).size());

        List<RecordedRequest> cursorRequests = fakeServer.getRequests("/cursors");
        assertEquals(1, cursorRequests.size());
        HttpUrl cursorUrl = cursorRequests.get(0).getRequestUrl();
        assertEquals("4", cursorUrl.queryParameter("numberOfCursors"));
        assertEquals("1500000000000", cursorUrl.queryParameter("minLastUpdatedTime"));

        // The cursors carry the time filters.
        for (RecordedRequest request : fakeServer.getRequests("/rows")) {
            HttpUrl url = request.getRequestUrl();
            assertNull(url.queryParameter("minLastUpdatedTime"));
            assertEquals("value", url.queryParameter("columns"));
            assertNotNull(url.queryParameter("cursor"));
        }
    }

    @Test
    void concurrentListWithLimitCapsPartitionsAndRows() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(40_000);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = new ArrayList<>();
        client.raw().rows().list(DB, TABLE, RequestParameters.create(),
                ListConfig.create().withPartitions(8).withChunkSize(5000).withLimit(25_000))
                .forEachRemaining(chunk -> {
                    assertTrue(chunk.size() <= 5000);
                    rows.addAll(chunk);
                });

        assertEquals(25_000, rows.size());
        assertEquals(25_000, rows.stream().map(RawRow::getKey).collect(Collectors.toSet()).size());
        // ceil(25 000 / 20 000) = 2 partitions
        assertEquals("2", fakeServer.getRequests("/cursors").get(0).getRequestUrl()
                .queryParameter("numberOfCursors"));
    }

    @Test
    void concurrentListRejectsLimitBelowChunkSize() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(100);
        CogniteClient client = startClient(fakeServer);

        assertThrows(IllegalArgumentException.class, () -> client.raw().rows().list(DB, TABLE,
                RequestParameters.create(),
                ListConfig.create().withPartitions(2).withChunkSize(5000).withLimit(100)));
        assertTrue(fakeServer.getRequests().isEmpty());
    }

    @Test
    void listAllWithLimitReadsSerially() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(300);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = client.raw().rows().listAll(DB, TABLE, RequestParameters.create(),
                ListConfig.create().withLimit(25));

        assertEquals(25, rows.size());
        assertTrue(fakeServer.getRequests("/cursors").isEmpty());
        assertEquals("25", fakeServer.getRequests("/rows").get(0).getRequestUrl().queryParameter("limit"));
    }

    @Test
    void listAllWithoutLimitReadsConcurrently() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(3000);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = client.raw().rows().listAll(DB, TABLE, RequestParameters.create(),
                ListConfig.create());

        assertEquals(3000, rows.size());
        assertEquals("8", fakeServer.getRequests("/cursors").get(0).getRequestUrl()
                .queryParameter("numberOfCursors"));
    }

    @Test
    void emptyColumnListIsSentAsComma() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(10);
        CogniteClient client = startClient(fakeServer);

        client.raw().rows().listAll(DB, TABLE, RequestParameters.create().withRootParameter("columns", List.of()),
                ListConfig.create().withLimit(10));

        assertEquals(",", fakeServer.getRequests("/rows").get(0).getRequestUrl().queryParameter("columns"));
    }

    @Test
    void listFromExplicitCursors() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(100);
        CogniteClient client = startClient(fakeServer);

        List<String> cursors = client.raw().rows().retrieveCursors(DB, TABLE,
                RequestParameters.create().withRootParameter("numberOfCursors", 3));
        List<RawRow> rows = new ArrayList<>();
        client.raw().rows().list(DB, TABLE, RequestParameters.create(), cursors.toArray(new String[0]))
                .forEachRemaining(rows::addAll);

        assertEquals(3, cursors.size());
        assertEquals(100, rows.size());
    }

    @Test
    void retrieveRowByKey() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(10);
        CogniteClient client = startClient(fakeServer);

        Optional<RawRow> found = client.raw().rows().retrieve(DB, TABLE, "key-3");
        Optional<RawRow> missing = client.raw().rows().retrieve(DB, TABLE, "key-42");

        assertTrue(found.isPresent());
        assertEquals("key-3", found.get().getKey());
        assertEquals("row 3", found.get().getColumns().get("name"));
        assertFalse(missing.isPresent());
    }

    @Test
    void upsertDeduplicatesAndBatchesRows() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(0);
        CogniteClient client = startClient(fakeServer);

        List<RawRow> rows = DataGenerator.generateRawRows(DB, TABLE, 12_000);
        List<RawRow> input = new ArrayList<>(rows);
        input.addAll(rows.subList(0, 100));
        client.raw().rows().upsert(input);

        List<RecordedRequest> requests = fakeServer.getRequests("/rows");
        assertEquals(3, requests.size());
        for (RecordedRequest request : requests) {
            assertEquals("true", request.getRequestUrl().queryParameter("ensureParent"));
        }
        assertEquals(12_000, fakeServer.getWrittenKeys().size());
        assertEquals(rows.stream().map(RawRow::getKey).collect(Collectors.toSet()),
                new HashSet<>(fakeServer.getWrittenKeys()));
    }

    @Test
    void upsertReportsFailedAndSuccessfulRows() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(0).withFailingTable("bad_table");
        CogniteClient client = startClient(fakeServer);

        List<RawRow> goodRows = DataGenerator.generateRawRows(DB, TABLE, 10);
        List<RawRow> badRows = DataGenerator.generateRawRows(DB, "bad_table", 5);
        List<RawRow> input = new ArrayList<>(goodRows);
        input.addAll(badRows);

        CogniteCompoundException exception = assertThrows(CogniteCompoundException.class,
                () -> client.raw().rows().upsert(input, false));

        Set<Object> expectedSuccessful = goodRows.stream().map(RawRow::getKey).collect(Collectors.toSet());
        Set<Object> expectedFailed = badRows.stream().map(RawRow::getKey).collect(Collectors.toSet());
        assertEquals(expectedSuccessful, new HashSet<>(exception.getSuccessful()));
        assertEquals(expectedFailed, new HashSet<>(exception.getFailed()));
        assertTrue(exception.getUnknown().isEmpty());
        assertEquals(1, exception.getExceptions().size());
    }

    @Test
    void deleteRowsByKey() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(0);
        CogniteClient client = startClient(fakeServer);

        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 2500; i++) {
            keys.add("key-" + i);
        }
        List<RawRow> deleted = client.raw().rows().delete(DB, TABLE, keys);

        assertEquals(2500, deleted.size());
        assertEquals(3, fakeServer.getRequests("/rows/delete").size());
        assertEquals(new HashSet<>(keys), new HashSet<>(fakeServer.getDeletedKeys()));
    }

    @Test
    void closingAnUnfinishedReadReleasesThePartitionWorkers() throws Exception {
        FakeRawServer fakeServer = new FakeRawServer(200_000);
        CogniteClient client = startClient(fakeServer)
                .withClientConfig(ClientConfig.create()
                        .withMaxRetries(1)
                        .withNoWorkers(2)
                        .withNoListPartitions(2)
                        .withBackpressureUnit(Duration.ofMillis(10)));

        try (CloseableIterator<List<RawRow>> rows = client.raw().rows().list(DB, TABLE,
                RequestParameters.create(), ListConfig.create().withPartitions(2).withChunkSize(1000))) {
            assertEquals(1000, rows.next().size());
        }

        List<RawRow> limited = assertTimeoutPreemptively(Duration.ofSeconds(15),
                () -> client.raw().rows().listAll(DB, TABLE, RequestParameters.create(),
                        ListConfig.create().withPartitions(2).withLimit(5000)));
        assertEquals(5000, limited.size());
        assertEquals(5000, new HashSet<>(limited.stream().map(RawRow::getKey).collect(Collectors.toList())).size());
    }
}
