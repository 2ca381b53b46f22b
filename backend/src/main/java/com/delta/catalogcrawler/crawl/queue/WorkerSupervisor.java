package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the worker threads: a fixed number per concurrency class, resizable at runtime. Each worker runs the
 * supplied loop with a {@link WorkerHandle} it must poll between tasks; a handle asked to retire finishes its
 * current task and exits, and the supervisor starts a fresh worker in its place when restarting.
 */
@Component
public class WorkerSupervisor {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final Object lifecycleLock = new Object();
    private final AtomicInteger workerIds = new AtomicInteger();
    private final AtomicInteger restarts = new AtomicInteger();
    private final Map<ConcurrencyClass, Integer> targetSizes = new EnumMap<>(ConcurrencyClass.class);
    private final List<WorkerHandle> handles = new ArrayList<>();

    private ExecutorService executor;
    private WorkerLoop loop;

    @FunctionalInterface
    public interface WorkerLoop {
        void run(WorkerHandle handle);
    }

    public void start(Map<ConcurrencyClass, Integer> sizes, WorkerLoop workerLoop) {
        synchronized (lifecycleLock) {
            if (executor != null) {
                return;
            }
            loop = workerLoop;
            executor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-worker");
                thread.setDaemon(true);
                return thread;
            });
            targetSizes.clear();
            targetSizes.putAll(sizes);
            for (Map.Entry<ConcurrencyClass, Integer> entry : sizes.entrySet()) {
                for (int i = 0; i < entry.getValue(); i++) {
                    spawn(entry.getKey());
                }
            }
            log.info("Worker pool started sizes={}", sizes);
        }
    }

    /**
     * Retires every worker after its current task and starts a replacement for each.
     */
    public void restartWorkers(String reason) {
        synchronized (lifecycleLock) {
            if (executor == null) {
                return;
            }
            List<WorkerHandle> current = new ArrayList<>(handles);
            for (WorkerHandle handle : current) {
                handle.retire();
            }
            handles.removeAll(current);
            for (Map.Entry<ConcurrencyClass, Integer> entry : targetSizes.entrySet()) {
                for (int i = 0; i < entry.getValue(); i++) {
                    spawn(entry.getKey());
                }
            }
            restarts.incrementAndGet();
            log.warn("Worker pool restarted reason={} workers={}", reason, handles.size());
        }
    }

    public void resize(ConcurrencyClass concurrencyClass, int size) {
        synchronized (lifecycleLock) {
            if (executor == null) {
                targetSizes.put(concurrencyClass, Math.max(0, size));
                return;
            }
            int target = Math.max(0, size);
            targetSizes.put(concurrencyClass, target);
            List<WorkerHandle> ofClass = new ArrayList<>();
            for (WorkerHandle handle : handles) {
                if (handle.getConcurrencyClass() == concurrencyClass) {
                    ofClass.add(handle);
                }
            }
            for (int i = ofClass.size(); i < target; i++) {
                spawn(concurrencyClass);
            }
            for (int i = target; i < ofClass.size(); i++) {
                WorkerHandle handle = ofClass.get(i);
                handle.retire();
                handles.remove(handle);
            }
            log.info("Worker pool resized class={} size={}", concurrencyClass, target);
        }
    }

    /**
     * Replaces workers whose loop ended without being asked to retire.
     *
     * @return how many workers were replaced
     */
    public int healthCheck() {
        synchronized (lifecycleLock) {
            if (executor == null) {
                return 0;
            }
            int replaced = 0;
            for (WorkerHandle handle : new ArrayList<>(handles)) {
                if (handle.future != null && handle.future.isDone() && !handle.isRetiring()) {
                    handles.remove(handle);
                    spawn(handle.getConcurrencyClass());
                    replaced++;
                    log.warn("Replaced dead worker id={} class={}", handle.getId(), handle.getConcurrencyClass());
                }
            }
            return replaced;
        }
    }

    /**
     * Asks every worker to retire, waits up to {@code graceMillis} for current tasks, then interrupts the rest.
     *
     * @return true when all workers exited within the grace period
     */
    public boolean stop(long graceMillis) {
        synchronized (lifecycleLock) {
            if (executor == null) {
                return true;
            }
            for (WorkerHandle handle : handles) {
                handle.retire();
            }
            handles.clear();
            executor.shutdown();
            boolean clean = false;
            try {
                clean = executor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS);
                if (!clean) {
                    executor.shutdownNow();
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                }
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            executor = null;
            log.info("Worker pool stopped clean={}", clean);
            return clean;
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null;
        }
    }

    public int activeWorkers() {
        synchronized (lifecycleLock) {
            return handles.size();
        }
    }

    public int activeWorkers(ConcurrencyClass concurrencyClass) {
        synchronized (lifecycleLock) {
            int count = 0;
            for (WorkerHandle handle : handles) {
                if (handle.getConcurrencyClass() == concurrencyClass) {
                    count++;
                }
            }
            return count;
        }
    }

    public int restartCount() {
        return restarts.get();
    }

    private void spawn(ConcurrencyClass concurrencyClass) {
        WorkerHandle handle = new WorkerHandle(workerIds.incrementAndGet(), concurrencyClass);
        WorkerLoop workerLoop = loop;
        handle.future = executor.submit(() -> {
            Thread.currentThread().setName("crawl-worker-" + concurrencyClass.name().toLowerCase(Locale.ROOT) + "-" + handle.getId());
            try {
                workerLoop.run(handle);
            } catch (RuntimeException e) {
                log.warn("Worker {} crashed", handle.getId(), e);
            }
        });
        handles.add(handle);
    }

    public static final class WorkerHandle {
        private final int id;
        private final ConcurrencyClass concurrencyClass;
        private volatile boolean retiring;
        private volatile Instant lastHeartbeat = Instant.now();
        private volatile Future<?> future;

        WorkerHandle(int id, ConcurrencyClass concurrencyClass) {
            this.id = id;
            this.concurrencyClass = concurrencyClass;
        }

        public int getId() {
            return id;
        }

        public ConcurrencyClass getConcurrencyClass() {
            return concurrencyClass;
        }

        public boolean shouldRun() {
            return !retiring && !Thread.currentThread().isInterrupted();
        }

        public boolean isRetiring() {
            return retiring;
        }

        public void heartbeat() {
            lastHeartbeat = Instant.now();
        }

        public Instant getLastHeartbeat() {
            return lastHeartbeat;
        }

        void retire() {
            retiring = true;
        }
    }
}
