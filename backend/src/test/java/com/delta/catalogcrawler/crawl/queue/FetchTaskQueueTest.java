package com.delta.catalogcrawler.crawl.queue;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ConcurrencyClass;
import com.delta.catalogcrawler.crawl.model.FetchTask;
import com.delta.catalogcrawler.crawl.model.FetchTaskKind;
import com.delta.catalogcrawler.crawl.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FetchTaskQueueTest {
    private MutableClock clock;
    private CrawlerProperties properties;
    private FetchTaskQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        properties = new CrawlerProperties();
        queue = new FetchTaskQueue(properties, clock);
    }

    @Test
    void duplicateWithinWindowReturnsExistingTask() {
        FetchTaskQueue.Submitted first = submit("job-1", "https://s.example/a", 5);
        FetchTaskQueue.Submitted second = submit("job-1", "https://s.example/a", 9);

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.task()).isSameAs(first.task());
        assertThat(queue.pendingCount()).isEqualTo(1);
        assertThat(queue.isDuplicate("job-1", "https://s.example/a")).isTrue();
    }

    @Test
    void sameUrlInAnotherJobIsNotADuplicate() {
        submit("job-1", "https://s.example/a", 5);

        assertThat(submit("job-2", "https://s.example/a", 5).created()).isTrue();
        assertThat(queue.pendingCount()).isEqualTo(2);
    }

    @Test
    void duplicateAfterWindowIsAccepted() {
        submit("job-1", "https://s.example/a", 5);
        clock.advance(Duration.ofSeconds(properties.getQueue().getDedupWindowSeconds() + 1L));

        assertThat(submit("job-1", "https://s.example/a", 5).created()).isTrue();
    }

    @Test
    void higherPriorityFirstThenEnqueueOrder() throws Exception {
        submit("job-1", "https://s.example/low", 1);
        submit("job-2", "https://s.example/first", 7);
        submit("job-3", "https://s.example/second", 7);

        assertThat(take().getUrl()).isEqualTo("https://s.example/first");
        assertThat(take().getUrl()).isEqualTo("https://s.example/second");
        assertThat(take().getUrl()).isEqualTo("https://s.example/low");
    }

    @Test
    void longWaitingTaskIsPromotedPastNewerHighPriorityWork() throws Exception {
        submit("job-1", "https://s.example/old", 1);
        clock.advance(Duration.ofSeconds(properties.getQueue().getMaxWaitPromotionSeconds() + 1L));
        submit("job-2", "https://s.example/new", 9);

        FetchTask taken = take();

        assertThat(taken.getUrl()).isEqualTo("https://s.example/old");
        assertThat(queue.effectivePriority(taken, clock.instant())).isEqualTo(1 + FetchTaskQueue.PROMOTION_STEP);
    }

    @Test
    void perJobInFlightCapHoldsBackFurtherTasks() throws Exception {
        int cap = properties.getQueue().getStandardPerJobInFlight();
        for (int i = 0; i <= cap; i++) {
            submit("job-1", "https://s.example/" + i, 5);
        }
        FetchTask first = take();
        for (int i = 1; i < cap; i++) {
            assertThat(take()).isNotNull();
        }

        assertThat(take()).isNull();
        assertThat(queue.inFlightCount("job-1")).isEqualTo(cap);

        queue.complete(first, TaskState.DONE);
        assertThat(take()).isNotNull();
        assertThat(first.getState()).isEqualTo(TaskState.DONE);
    }

    @Test
    void classesAreServedSeparately() throws Exception {
        queue.submit("job-1", "https://s.example/t", FetchTaskKind.ROOT, 5, ConcurrencyClass.TRUSTED, 0, 0);

        assertThat(queue.take(ConcurrencyClass.STANDARD, 0)).isNull();
        assertThat(queue.take(ConcurrencyClass.TRUSTED, 0)).isNotNull();
    }

    @Test
    void delayedTaskWaitsUntilDue() throws Exception {
        queue.submit("job-1", "https://s.example/later", FetchTaskKind.PAGINATION, 5, ConcurrencyClass.STANDARD, 0, 5_000);

        assertThat(take()).isNull();
        clock.advance(Duration.ofSeconds(6));
        assertThat(take()).isNotNull();
    }

    @Test
    void retryLaterPutsTaskBackAsPending() throws Exception {
        submit("job-1", "https://s.example/a", 5);
        FetchTask task = take();

        queue.retryLater(task, 1_000);

        assertThat(task.getState()).isEqualTo(TaskState.PENDING);
        assertThat(queue.inFlightCount("job-1")).isZero();
        assertThat(take()).isNull();
        clock.advance(Duration.ofSeconds(2));
        assertThat(take()).isSameAs(task);
    }

    @Test
    void deferLowestPriorityPushesBackOnlyTheLowest() throws Exception {
        submit("job-1", "https://s.example/low", 1);
        submit("job-1", "https://s.example/high", 9);

        assertThat(queue.deferLowestPriority(1, 60_000)).isEqualTo(1);

        assertThat(take().getUrl()).isEqualTo("https://s.example/high");
        assertThat(take()).isNull();
    }

    @Test
    void removeJobDropsOnlyThatJobsPendingTasks() {
        submit("job-1", "https://s.example/a", 5);
        submit("job-1", "https://s.example/b", 5);
        submit("job-2", "https://s.example/c", 5);

        assertThat(queue.removeJob("job-1")).hasSize(2);
        assertThat(queue.pendingCount("job-1")).isZero();
        assertThat(queue.pendingCount("job-2")).isEqualTo(1);
    }

    @Test
    void closedIntakeRefusesNewJobs() {
        queue.closeIntake();

        assertThat(queue.submit("job-1", "https://s.example/", FetchTaskKind.ROOT, 5, ConcurrencyClass.STANDARD, 0, 0)).isNull();

        queue.openIntake();
        assertThat(queue.submit("job-1", "https://s.example/", FetchTaskKind.ROOT, 5, ConcurrencyClass.STANDARD, 0, 0)).isNotNull();
    }

    @Test
    void followUpsSubmittedWhileClosedAreParkedForShutdown() throws Exception {
        submit("job-1", "https://s.example/a", 5);
        queue.closeIntake();

        FetchTaskQueue.Submitted parked = submit("job-1", "https://s.example/b", 5);

        assertThat(parked.created()).isTrue();
        assertThat(queue.pendingCount("job-1")).isEqualTo(2);
        assertThat(take().getUrl()).isEqualTo("https://s.example/a");
        assertThat(take()).isNull();
        assertThat(queue.drainPending()).extracting(FetchTask::getUrl).containsExactly("https://s.example/b");
        assertThat(queue.pendingCount()).isZero();
    }

    @Test
    void reopeningIntakeReleasesParkedTasks() throws Exception {
        queue.closeIntake();
        submit("job-1", "https://s.example/b", 5);

        queue.openIntake();

        assertThat(take().getUrl()).isEqualTo("https://s.example/b");
    }

    private FetchTaskQueue.Submitted submit(String jobId, String url, int priority) {
        return queue.submit(jobId, url, FetchTaskKind.PAGINATION, priority, ConcurrencyClass.STANDARD, 0, 0);
    }

    private FetchTask take() throws InterruptedException {
        return queue.take(ConcurrencyClass.STANDARD, 0);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
