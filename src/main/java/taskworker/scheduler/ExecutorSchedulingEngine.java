package taskworker.scheduler;

import taskworker.trigger.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Scheduling engine on a single daemon thread.
 *
 * Every job is re-armed from its trigger after each run, so fires of all jobs
 * run one at a time. Fire times missed while a previous run overran are
 * coalesced into the next future fire.
 */
public class ExecutorSchedulingEngine implements SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutorSchedulingEngine.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final List<EngineJob> pending = new ArrayList<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running = false;

    public ExecutorSchedulingEngine(Clock clock) {
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "taskworker-scheduler");
            t.setDaemon(true);
            return t;
        });
        // fires that are armed but not due are dropped on shutdown
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor = pool;
        this.clock = clock;
    }

    @Override
    public synchronized void addJob(String id, Trigger trigger, Runnable action) {
        EngineJob job = new EngineJob(id, trigger, wrapRunnable(id, action));
        if (running) {
            arm(job, trigger.firstFireTime(clock.instant()));
        } else {
            pending.add(job);
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        Instant now = clock.instant();
        for (EngineJob job : pending) {
            arm(job, job.trigger.firstFireTime(now));
            log.info("Job {} scheduled ({})", job.id, job.trigger);
        }
        pending.clear();

        log.info("Scheduler started");
    }

    @Override
    public void shutdown() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }

        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            terminated.countDown();
        }
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void arm(EngineJob job, Optional<Instant> fireTime) {
        if (fireTime.isEmpty()) {
            log.info("Job {} has no further fire times", job.id);
            return;
        }
        if (!running) {
            return;
        }

        Instant fireAt = fireTime.get();
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis()) + jitterMillis(job.trigger);

        try {
            executor.schedule(() -> fire(job, fireAt), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Job {} not re-armed, scheduler is stopping", job.id);
        }
    }

    private void fire(EngineJob job, Instant fireAt) {
        try {
            job.action.run();
        } finally {
            arm(job, nextAfterRun(job, fireAt));
        }
    }

    private Optional<Instant> nextAfterRun(EngineJob job, Instant fireAt) {
        Instant now = clock.instant();
        Optional<Instant> next = job.trigger.nextFireTime(fireAt);
        int missed = 0;
        while (next.isPresent() && next.get().isBefore(now)) {
            next = job.trigger.nextFireTime(next.get());
            missed++;
        }
        if (missed > 0) {
            log.warn("Job {} overran, coalesced {} missed fire(s)", job.id, missed);
        }
        return next;
    }

    private static long jitterMillis(Trigger trigger) {
        long bound = trigger.jitter().toMillis();
        return bound > 0 ? ThreadLocalRandom.current().nextLong(bound + 1) : 0L;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private static Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable e) {
                log.error("{} error", name, e);
                Failures.rethrowIfFatal(e);
            }
        };
    }

    private record EngineJob(String id, Trigger trigger, Runnable action) {
    }
}
