package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FetchTask;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.TaskState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending fetch tasks of all jobs.
 * <p>
 * Tasks are handed out by effective priority, then enqueue order. Effective priority grows by
 * {@link #PROMOTION_STEP} for every full max-wait period a task has been waiting, so old low-priority work
 * eventually overtakes newer high-priority work. A job never has more tasks in flight than its concurrency class
 * allows. Submitting the same (job, normalized URL) again within the dedup window returns the task already known.
 * While intake is closed, new jobs are refused and follow-up tasks of running jobs are parked: they are never
 * handed out but are returned by {@link #drainPending()} so shutdown can save them.
 * All state is guarded by one lock.
 */
@Component
public class FetchTaskQueue {
    static final int PROMOTION_STEP = 10;

    private final CrawlerProperties properties;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final List<FetchTask> pending = new ArrayList<>();
    private final List<FetchTask> parked = new ArrayList<>();
    private final Map<String, Submission> recent = new HashMap<>();
    private final Map<String, Integer> inFlightByJob = new HashMap<>();

    private long sequence;
    private boolean intakeOpen = true;
    private Instant lastPrune = Instant.EPOCH;

    @Autowired
    public FetchTaskQueue(CrawlerProperties properties) {
        this(properties, Clock.systemUTC());
    }

    FetchTaskQueue(CrawlerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the queued task, the existing task for a duplicate submission ({@code created == false}),
     *     or null for a {@link FetchTaskKind#ROOT} task while intake is closed
     */
    public Submitted submit(
        String jobId,
        String url,
        FetchTaskKind kind,
        int priority,
        ConcurrencyClass concurrencyClass,
        int attempts,
        long delayMs
    ) {
        lock.lock();
        try {
            if (!intakeOpen && kind == FetchTaskKind.ROOT) {
                return null;
            }
            Instant now = clock.instant();
            pruneExpired(now);
            String key = dedupKey(jobId, url);
            Submission existing = recent.get(key);
            if (existing != null && !existing.expired(now, dedupWindow())) {
                return new Submitted(existing.task(), false);
            }
            FetchTask task = new FetchTask(++sequence, jobId, url, kind, priority, concurrencyClass, now, attempts);
            if (delayMs > 0) {
                task.setNotBefore(now.plusMillis(delayMs));
            }
            recent.put(key, new Submission(task, now));
            if (!intakeOpen) {
                parked.add(task);
                return new Submitted(task, true);
            }
            pending.add(task);
            changed.signalAll();
            return new Submitted(task, true);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDuplicate(String jobId, String url) {
        lock.lock();
        try {
            Submission existing = recent.get(dedupKey(jobId, url));
            return existing != null && !existing.expired(clock.instant(), dedupWindow());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeoutMs} for a task of {@code concurrencyClass} that is due and whose job has
     * in-flight capacity. The returned task is marked in flight.
     */
    public FetchTask take(ConcurrencyClass concurrencyClass, long timeoutMs) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));
        lock.lockInterruptibly();
        try {
            while (true) {
                Instant now = clock.instant();
                FetchTask best = selectBest(concurrencyClass, now);
                if (best != null) {
                    pending.remove(best);
                    best.setState(TaskState.IN_FLIGHT);
                    inFlightByJob.merge(best.getJobId(), 1, Integer::sum);
                    return best;
                }
                if (remaining <= 0) {
                    return null;
                }
                long wait = Math.min(remaining, nanosUntilNextDue(concurrencyClass, now));
                long before = System.nanoTime();
                changed.awaitNanos(Math.max(1, wait));
                remaining -= System.nanoTime() - before;
            }
        } finally {
            lock.unlock();
        }
    }

    public void complete(FetchTask task, TaskState finalState) {
        lock.lock();
        try {
            task.setState(finalState);
            releaseInFlight(task.getJobId());
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts an in-flight task back as pending, due after {@code delayMs}.
     */
    public void retryLater(FetchTask task, long delayMs) {
        lock.lock();
        try {
            task.setState(TaskState.FAILED_RETRYABLE);
            releaseInFlight(task.getJobId());
            task.setNotBefore(clock.instant().plusMillis(Math.max(0, delayMs)));
            task.setState(TaskState.PENDING);
            pending.add(task);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pushes back the {@code count} lowest-priority pending tasks of any job by {@code delayMs}.
     *
     * @return how many tasks were deferred
     */
    public int deferLowestPriority(int count, long delayMs) {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<FetchTask> candidates = new ArrayList<>(pending);
            candidates.sort((a, b) -> {
                int byPriority = Integer.compare(effectivePriority(a, now), effectivePriority(b, now));
                return byPriority != 0 ? byPriority : Long.compare(b.getSequence(), a.getSequence());
            });
            int deferred = 0;
            Instant until = now.plusMillis(Math.max(0, delayMs));
            for (FetchTask task : candidates) {
                if (deferred >= count) {
                    break;
                }
                if (task.getNotBefore() == null || task.getNotBefore().isBefore(until)) {
                    task.setNotBefore(until);
                    deferred++;
                }
            }
            return deferred;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every pending task of a job. In-flight tasks are left to finish.
     */
    public List<FetchTask> removeJob(String jobId) {
        lock.lock();
        try {
            List<FetchTask> removed = new ArrayList<>();
            removeJobTasks(pending, jobId, removed);
            removeJobTasks(parked, jobId, removed);
            changed.signalAll();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every pending and parked task.
     */
    public List<FetchTask> drainPending() {
        lock.lock();
        try {
            List<FetchTask> drained = new ArrayList<>(pending);
            drained.addAll(parked);
            pending.clear();
            parked.clear();
            changed.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public void forgetJob(String jobId) {
        lock.lock();
        try {
            recent.keySet().removeIf(key -> key.startsWith(jobId + "|"));
        } finally {
            lock.unlock();
        }
    }

    public void closeIntake() {
        lock.lock();
        try {
            intakeOpen = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void openIntake() {
        lock.lock();
        try {
            intakeOpen = true;
            pending.addAll(parked);
            parked.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size() + parked.size();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount(String jobId) {
        lock.lock();
        try {
            int count = 0;
            for (FetchTask task : pending) {
                if (task.getJobId().equals(jobId)) {
                    count++;
                }
            }
            for (FetchTask task : parked) {
                if (task.getJobId().equals(jobId)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount(String jobId) {
        lock.lock();
        try {
            return inFlightByJob.getOrDefault(jobId, 0);
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            int total = 0;
            for (int value : inFlightByJob.values()) {
                total += value;
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    int effectivePriority(FetchTask task, Instant now) {
        long waitedMs = Math.max(0, Duration.between(task.getEnqueuedAt(), now).toMillis());
        long periodMs = properties.getQueue().getMaxWaitPromotionSeconds() * 1000L;
        long periods = waitedMs / periodMs;
        return (int) Math.min(Integer.MAX_VALUE, task.getPriority() + periods * PROMOTION_STEP);
    }

    private FetchTask selectBest(ConcurrencyClass concurrencyClass, Instant now) {
        int cap = perJobCap(concurrencyClass);
        FetchTask best = null;
        int bestPriority = Integer.MIN_VALUE;
        for (FetchTask task : pending) {
            if (task.getConcurrencyClass() != concurrencyClass || !task.isReady(now)) {
                continue;
            }
            if (inFlightByJob.getOrDefault(task.getJobId(), 0) >= cap) {
                continue;
            }
            int priority = effectivePriority(task, now);
            if (best == null || priority > bestPriority
                || (priority == bestPriority && task.getSequence() < best.getSequence())) {
                best = task;
                bestPriority = priority;
            }
        }
        return best;
    }

    private long nanosUntilNextDue(ConcurrencyClass concurrencyClass, Instant now) {
        long next = TimeUnit.MILLISECONDS.toNanos(properties.getQueue().getPollIntervalMs());
        for (FetchTask task : pending) {
            if (task.getConcurrencyClass() == concurrencyClass && task.getNotBefore() != null && task.getNotBefore().isAfter(now)) {
                next = Math.min(next, Duration.between(now, task.getNotBefore()).toNanos());
            }
        }
        return next;
    }

    private int perJobCap(ConcurrencyClass concurrencyClass) {
        return concurrencyClass == ConcurrencyClass.TRUSTED
            ? properties.getQueue().getTrustedPerJobInFlight()
            : properties.getQueue().getStandardPerJobInFlight();
    }

    private static void removeJobTasks(List<FetchTask> tasks, String jobId, List<FetchTask> removed) {
        Iterator<FetchTask> iterator = tasks.iterator();
        while (iterator.hasNext()) {
            FetchTask task = iterator.next();
            if (task.getJobId().equals(jobId)) {
                iterator.remove();
                removed.add(task);
            }
        }
    }

    private void releaseInFlight(String jobId) {
        inFlightByJob.computeIfPresent(jobId, (ignored, count) -> count <= 1 ? null : count - 1);
    }

    private void pruneExpired(Instant now) {
        if (Duration.between(lastPrune, now).toMillis() < 1000) {
            return;
        }
        lastPrune = now;
        Duration window = dedupWindow();
        recent.values().removeIf(submission -> submission.expired(now, window));
    }

    private Duration dedupWindow() {
        return Duration.ofSeconds(properties.getQueue().getDedupWindowSeconds());
    }

    private static String dedupKey(String jobId, String url) {
        return jobId + "|" + url;
    }

    public record Submitted(FetchTask task, boolean created) {
    }

    private record Submission(FetchTask task, Instant submittedAt) {
        boolean expired(Instant now, Duration window) {
            return submittedAt.plus(window).isBefore(now);
        }
    }
}
