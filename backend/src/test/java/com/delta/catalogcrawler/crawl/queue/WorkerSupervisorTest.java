package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerSupervisorTest {
    private final WorkerSupervisor supervisor = new WorkerSupervisor();
    private final Set<Integer> started = ConcurrentHashMap.newKeySet();

    @AfterEach
    void tearDown() {
        supervisor.stop(1000);
    }

    @Test
    void startsWorkersPerClass() throws Exception {
        supervisor.start(Map.of(ConcurrencyClass.STANDARD, 2, ConcurrencyClass.TRUSTED, 3), this::idleLoop);

        waitFor(() -> started.size() == 5);
        assertThat(supervisor.activeWorkers()).isEqualTo(5);
        assertThat(supervisor.activeWorkers(ConcurrencyClass.TRUSTED)).isEqualTo(3);
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    void restartReplacesEveryWorker() throws Exception {
        supervisor.start(Map.of(ConcurrencyClass.STANDARD, 2), this::idleLoop);
        waitFor(() -> started.size() == 2);

        supervisor.restartWorkers("memory_pressure");

        waitFor(() -> started.size() == 4);
        assertThat(supervisor.activeWorkers()).isEqualTo(2);
        assertThat(supervisor.restartCount()).isEqualTo(1);
    }

    @Test
    void resizeGrowsAndShrinksOneClass() throws Exception {
        supervisor.start(Map.of(ConcurrencyClass.STANDARD, 1, ConcurrencyClass.TRUSTED, 1), this::idleLoop);

        supervisor.resize(ConcurrencyClass.STANDARD, 3);
        assertThat(supervisor.activeWorkers(ConcurrencyClass.STANDARD)).isEqualTo(3);

        supervisor.resize(ConcurrencyClass.STANDARD, 1);
        assertThat(supervisor.activeWorkers(ConcurrencyClass.STANDARD)).isEqualTo(1);
        assertThat(supervisor.activeWorkers(ConcurrencyClass.TRUSTED)).isEqualTo(1);
    }

    @Test
    void crashedWorkerIsReplacedByHealthCheck() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        supervisor.start(Map.of(ConcurrencyClass.STANDARD, 1), handle -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            idleLoop(handle);
        });
        waitFor(() -> runs.get() == 1);
        Thread.sleep(50);

        assertThat(supervisor.healthCheck()).isEqualTo(1);
        waitFor(() -> runs.get() == 2);
        assertThat(supervisor.activeWorkers()).isEqualTo(1);
    }

    @Test
    void stopRetiresWorkers() throws Exception {
        supervisor.start(Map.of(ConcurrencyClass.STANDARD, 2), this::idleLoop);
        waitFor(() -> started.size() == 2);

        assertThat(supervisor.stop(2000)).isTrue();
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.activeWorkers()).isZero();
    }

    private void idleLoop(WorkerSupervisor.WorkerHandle handle) {
        started.add(handle.getId());
        while (handle.shouldRun()) {
            handle.heartbeat();
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}
