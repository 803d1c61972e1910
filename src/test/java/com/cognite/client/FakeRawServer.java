package com.cognite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Serves a single Raw table with {@code noRows} rows keyed {@code key-<n>}.
 *
 * Cursors encode the remaining row range as {@code <from>:<to>}. Written and deleted rows are recorded by key.
 * Writes to a table named in {@code failingTables} are rejected with a 400.
 */
class FakeRawServer extends Dispatcher {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final int noRows;
    private final Set<String> failingTables = ConcurrentHashMap.newKeySet();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final List<String> writtenKeys = new CopyOnWriteArrayList<>();
    private final List<String> deletedKeys = new CopyOnWriteArrayList<>();

    FakeRawServer(int noRows) {
        this.noRows = noRows;
    }

    FakeRawServer withFailingTable(String tableName) {
        failingTables.add(tableName);
        return this;
    }

    List<RecordedRequest> getRequests() {
        return requests;
    }

    List<RecordedRequest> getRequests(String pathSuffix) {
        return requests.stream()
                .filter(request -> request.getRequestUrl().encodedPath().endsWith(pathSuffix))
                .collect(Collectors.toList());
    }

    List<String> getWrittenKeys() {
        return writtenKeys;
    }

    List<String> getDeletedKeys() {
        return deletedKeys;
    }

    @Override
    public MockResponse dispatch(RecordedRequest request) {
        requests.add(request);
        try {
            HttpUrl url = request.getRequestUrl();
            List<String> segments = url.pathSegments();
            String last = segments.get(segments.size() - 1);

            if ("GET".equals(request.getMethod()) && "cursors".equals(last)) {
                return cursors(Integer.parseInt(url.queryParameter("numberOfCursors")));
            }
            if ("GET".equals(request.getMethod()) && "rows".equals(last)) {
                return rows(url);
            }
            if ("GET".equals(request.getMethod()) && "rows".equals(segments.get(segments.size() - 2))) {
                return row(last);
            }
            if ("POST".equals(request.getMethod()) && "rows".equals(last)) {
                return recordKeys(request, segments, writtenKeys);
            }
            if ("POST".equals(request.getMethod()) && "delete".equals(last)) {
                return recordKeys(request, segments, deletedKeys);
            }
            return new MockResponse().setResponseCode(404)
                    .setBody("{\"error\":{\"code\":404,\"message\":\"Not found\"}}");
        } catch (Exception e) {
            return new MockResponse().setResponseCode(500)
                    .setBody("{\"error\":{\"code\":500,\"message\":\"" + e.getMessage() + "\"}}");
        }
    }

    private MockResponse cursors(int noCursors) throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode items = root.putArray("items");
        for (int i = 0; i < noCursors; i++) {
            items.add((long) noRows * i / noCursors + ":" + (long) noRows * (i + 1) / noCursors);
        }
        return json(root);
    }

    private MockResponse rows(HttpUrl url) throws Exception {
        int from = 0;
        int to = noRows;
        String cursor = url.queryParameter("cursor");
        if (null != cursor) {
            String[] range = cursor.split(":");
            from = Integer.parseInt(range[0]);
            to = Integer.parseInt(range[1]);
        }
        int limit = Integer.parseInt(url.queryParameter("limit"));
        int end = Math.min(to, from + limit);

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode items = root.putArray("items");
        for (int i = from; i < end; i++) {
            items.add(rowNode(i));
        }
        if (end < to) {
            root.put("nextCursor", end + ":" + to);
        }
        return json(root);
    }

    private MockResponse row(String key) throws Exception {
        int index = Integer.parseInt(key.substring("key-".length()));
        if (index >= noRows) {
            return new MockResponse().setResponseCode(404)
                    .setBody("{\"error\":{\"code\":404,\"message\":\"Row not found\"}}");
        }
        return json(rowNode(index));
    }

    private MockResponse recordKeys(RecordedRequest request, List<String> segments, List<String> keys)
            throws Exception {
        String tableName = segments.get(segments.indexOf("tables") + 1);
        if (failingTables.contains(tableName)) {
            return new MockResponse().setResponseCode(400)
                    .setBody("{\"error\":{\"code\":400,\"message\":\"Rejected table " + tableName + "\"}}");
        }
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        List<String> received = new ArrayList<>();
        for (JsonNode item : body.path("items")) {
            received.add(item.path("key").textValue());
        }
        keys.addAll(received);
        return json(objectMapper.createObjectNode());
    }

    private static ObjectNode rowNode(int index) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("key", "key-" + index);
        row.put("lastUpdatedTime", 1_600_000_000_000L + index);
        row.putObject("columns")
                .put("value", index)
                .put("name", "row " + index);
        return row;
    }

    private static MockResponse json(JsonNode node) throws Exception {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(objectMapper.writeValueAsString(node));
    }
}
