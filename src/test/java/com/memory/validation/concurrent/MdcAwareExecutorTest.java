package com.memory.validation.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = MdcAwareExecutor.fixed("test-worker", 2);

    @AfterEach
    void tearDown() throws InterruptedException {
        MDC.clear();
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_propagatesCallerMdc() {
        MDC.put("batchId", "batch-42");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("batchId"), executor).join();

        assertThat(seen).isEqualTo("batch-42");
    }

    @Test
    void execute_clearsMdcAfterTask() {
        MDC.put("batchId", "batch-1");
        CompletableFuture.runAsync(() -> { }, executor).join();
        MDC.clear();

        // Same pool threads, no MDC from the earlier task
        String seen = CompletableFuture.supplyAsync(() -> MDC.get("batchId"), executor).join();

        assertThat(seen).isNull();
    }

    @Test
    void fixed_namesWorkerThreads() {
        String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor).join();

        assertThat(name).startsWith("test-worker-");
    }
}
