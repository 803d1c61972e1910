package com.cognite.client.servicesV1.executor;

import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.exception.CogniteConnectionException;
import com.google.common.collect.ImmutableList;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RequestExecutorTest {
    private MockWebServer server;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        OkHttpClient client = new OkHttpClient.Builder()
                .retryOnConnectionFailure(false)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();
        executor = RequestExecutor.of(client)
                .withMaxRetries(2)
                .withMaxRetryBackoff(Duration.ZERO);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private Request request() {
        return new Request.Builder().url(server.url("/items")).build();
    }

    @Test
    void retriesOnServiceUnavailable() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody("{\"items\":[]}").setHeader("x-request-id", "abc"));

        ResponseBinary response = executor.executeRequest(request());

        assertTrue(response.isSuccessful());
        assertEquals("abc", response.getRequestId());
        assertEquals("{\"items\":[]}", response.getResponseBodyBytes().utf8());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void clientErrorIsNotRetried() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setHeader("x-request-id", "req-1")
                .setBody("{\"error\":{\"code\":400,\"message\":\"Rows not found\","
                        + "\"missing\":[{\"key\":\"row-1\"}]}}"));

        CogniteApiException exception = assertThrows(CogniteApiException.class,
                () -> executor.executeRequest(request()));

        assertEquals(400, exception.getCode());
        assertEquals("req-1", exception.getRequestId());
        assertEquals("row-1", exception.getMissing().get(0).get("key"));
        assertTrue(exception.getMessage().startsWith("Rows not found"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void autoRetryableHeaderTriggersRetry() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).setHeader("cdf-is-auto-retryable", "true"));
        server.enqueue(new MockResponse().setBody("{}"));

        assertTrue(executor.executeRequest(request()).isSuccessful());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void retryableErrorRaisedWhenRetriesExhausted() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        }

        CogniteApiException exception = assertThrows(CogniteApiException.class,
                () -> executor.executeRequest(request()));
        assertEquals(503, exception.getCode());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void validResponseCodesAreReturned() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"error\":{\"code\":409}}"));

        ResponseBinary response = executor
                .withValidResponseCodes(ImmutableList.of(409))
                .executeRequest(request());

        assertEquals(409, response.getResponseCode());
        assertFalse(response.isSuccessful());
    }

    @Test
    void connectionFailuresRaiseConnectionException() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        }

        CogniteConnectionException exception = assertThrows(CogniteConnectionException.class,
                () -> executor.executeRequest(request()));
        assertNotNull(exception.getCause());
    }

    @Test
    void asyncFailureCompletesExceptionally() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":{\"message\":\"gone\"}}"));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> executor.executeRequestAsync(request()).get(10, TimeUnit.SECONDS));
        Throwable cause = exception.getCause() instanceof CompletionException
                ? exception.getCause().getCause() : exception.getCause();
        assertTrue(cause instanceof CogniteApiException);
        assertEquals(404, ((CogniteApiException) cause).getCode());
    }
}
