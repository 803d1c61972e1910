package com.cognite.client.util;

import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.exception.CogniteCompoundException;
import com.cognite.client.exception.CogniteDuplicatedException;
import com.cognite.client.exception.CogniteNotFoundException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutorTest {
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void successfulTasksKeepTaskOrder() throws Exception {
        TasksSummary<List<Integer>, List<Integer>> summary = TaskExecutor.execute(
                batch -> batch.stream().map(i -> i * 10).collect(Collectors.toList()),
                List.of(List.of(1, 2), List.of(3), List.of(4, 5)),
                executor);

        assertTrue(summary.getExceptions().isEmpty());
        assertEquals(3, summary.getSuccessfulTasks().size());
        assertEquals(List.of(10, 20, 30, 40, 50), summary.<Integer>joinedResults(result -> result));
        summary.throwCompoundExceptionIfFailedTasks();
    }

    @Test
    void classifiesTaskOutcomes() throws Exception {
        TasksSummary<Integer, Integer> summary = TaskExecutor.execute(task -> {
                    if (task == 3) {
                        throw new CogniteApiException("server error", 500, "req-3");
                    }
                    if (task == 4) {
                        throw new CogniteApiException("bad request", 400, "req-4");
                    }
                    if (task == 5) {
                        throw new IllegalStateException("boom");
                    }
                    return task;
                },
                List.of(1, 2, 3, 4, 5),
                executor);

        assertEquals(List.of(1, 2), summary.getSuccessfulTasks());
        assertEquals(List.of(3), summary.getUnknownTasks());
        assertEquals(List.of(4, 5), summary.getFailedTasks());
        assertEquals(3, summary.getExceptions().size());

        CogniteCompoundException exception = assertThrows(CogniteCompoundException.class,
                summary::throwCompoundExceptionIfFailedTasks);
        assertFalse(exception instanceof CogniteNotFoundException);
        assertEquals(ImmutableList.of(1, 2), exception.getSuccessful());
        assertEquals(ImmutableList.of(4, 5), exception.getFailed());
        assertEquals(ImmutableList.of(3), exception.getUnknown());
        assertEquals(3, exception.getExceptions().size());
    }

    @Test
    void missingItemsRaiseNotFound() throws Exception {
        Map<String, Object> missingItem = ImmutableMap.of("name", "b");
        TasksSummary<List<String>, List<String>> summary = TaskExecutor.execute(batch -> {
                    if (batch.contains("b")) {
                        throw new CogniteApiException("not found", 400, null,
                                List.of(missingItem), List.of());
                    }
                    return batch;
                },
                List.of(List.of("a"), List.of("b", "c")),
                executor);

        CogniteNotFoundException exception = assertThrows(CogniteNotFoundException.class,
                () -> summary.<String>throwCompoundExceptionIfFailedTasks(batch -> batch, name -> name));
        assertEquals(List.of(missingItem), exception.getNotFound());
        assertEquals(ImmutableList.of("a"), exception.getSuccessful());
        assertEquals(ImmutableList.of("b", "c"), exception.getFailed());
        assertEquals(400, exception.getCode().orElse(-1));
    }

    @Test
    void duplicatedItemsRaiseDuplicated() throws Exception {
        Map<String, Object> duplicatedItem = ImmutableMap.of("name", "a");
        TasksSummary<String, String> summary = TaskExecutor.execute(task -> {
                    throw new CogniteApiException("conflict", 409, null, List.of(), List.of(duplicatedItem));
                },
                List.of("a"),
                executor);

        CogniteDuplicatedException exception = assertThrows(CogniteDuplicatedException.class,
                summary::throwCompoundExceptionIfFailedTasks);
        assertEquals(List.of(duplicatedItem), exception.getDuplicated());
    }

    @Test
    void runsOnPriorityExecutor() throws Exception {
        PriorityThreadPoolExecutor priorityExecutor = new PriorityThreadPoolExecutor(2);
        try {
            TasksSummary<Integer, Integer> summary = TaskExecutor.execute(task -> task + 1,
                    List.of(1, 2, 3), priorityExecutor, 2);
            assertEquals(List.of(2, 3, 4), summary.getResults());
        } finally {
            priorityExecutor.shutdownNow();
        }
    }

    @Test
    void unwrapStripsWrappers() {
        IllegalStateException root = new IllegalStateException("root");
        assertSame(root, TaskExecutor.unwrap(new ExecutionException(new CompletionException(root))));
        assertSame(root, TaskExecutor.unwrap(root));
    }
}
