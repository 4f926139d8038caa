package taskworker;

import taskworker.exception.DuplicateTaskException;
import taskworker.exception.InvalidTriggerException;
import taskworker.exception.MissingDatabaseUriException;
import taskworker.exception.UnknownTaskException;
import taskworker.model.ExecutionRecord;
import taskworker.model.JobStatus;
import taskworker.model.ScheduledJob;
import taskworker.registry.TaskHandle;
import taskworker.registry.TaskSignature;
import taskworker.config.WorkerConfig;
import taskworker.scheduler.ExecutionScope;
import taskworker.scheduler.ExecutorSchedulingEngine;
import taskworker.scheduler.SimulatedSchedulingEngine;
import taskworker.store.H2JobStore;
import taskworker.trigger.CronSchedule;
import taskworker.trigger.DateSchedule;
import taskworker.trigger.ScheduledAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskWorkerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private SimulatedSchedulingEngine engine;
    private TaskWorker worker;

    @BeforeEach
    void setup() {
        clock = new MutableClock(T0);
        engine = new SimulatedSchedulingEngine(clock);
        worker = new TaskWorker(clock, ExecutionScope.direct(), engine);
    }

    @AfterEach
    void teardown() {
        worker.shutdown();
    }

    private static Map<String, String> h2Config() {
        return Map.of("TASKER_DATABASE_URI",
                "jdbc:h2:mem:worker-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
    }

    @Test
    void missingDatabaseUriFailsInit() {
        assertThrows(MissingDatabaseUriException.class, () -> worker.init(Map.of()));
        assertNull(worker.jobStore());
        assertNull(worker.config());
    }

    @Test
    void hostDatabaseUrlIsAccepted() {
        worker.init(Map.of("DATABASE_URL", "jdbc:h2:mem:host-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1"));

        assertInstanceOf(H2JobStore.class, worker.jobStore());
    }

    @Test
    void initTwiceIsRejected() {
        worker.init(h2Config());

        assertThrows(IllegalStateException.class, () -> worker.init(h2Config()));
    }

    @Test
    void duplicateDefinitionsAreRejected() {
        worker.defineTask("mail.send", args -> null);
        worker.defineCronTask("nightly", CronSchedule.create().hour("3"), () -> null);

        assertThrows(DuplicateTaskException.class, () -> worker.defineTask("mail.send", args -> 1));
        assertThrows(DuplicateTaskException.class,
                () -> worker.defineDateTask("nightly", DateSchedule.now(), () -> null));
    }

    @Test
    void cronRegistrationReturnsTheActionAndValidates() {
        ScheduledAction action = () -> "ok";

        assertSame(action, worker.defineCronTask("heartbeat", CronSchedule.create().second("*/5"), action));
        assertThrows(InvalidTriggerException.class,
                () -> worker.defineCronTask("broken", CronSchedule.create().minute("75"), action));
    }

    @Test
    void definitionsAfterStartAreRejected() {
        worker.init(h2Config());
        worker.start();

        assertTrue(worker.isStarted());
        assertThrows(IllegalStateException.class, () -> worker.defineTask("late", args -> null));
        assertThrows(IllegalStateException.class,
                () -> worker.defineDateTask("late", DateSchedule.now(), () -> null));
    }

    @Test
    void applyBeforeInitIsRejected() {
        TaskHandle handle = worker.defineTask("t", args -> null);

        assertThrows(IllegalStateException.class, () -> handle.apply(Map.of()));
    }

    @Test
    void endToEnd() {
        List<String> delivered = new ArrayList<>();
        List<Instant> heartbeats = new ArrayList<>();

        worker.init(h2Config());
        TaskHandle sendEmail = worker.defineTask("send_email", TaskSignature.of("to", "subject"), args -> {
            delivered.add((String) args.get("to"));
            return Map.of("ok", true);
        });
        worker.defineCronTask("heartbeat", CronSchedule.create().second("*/5"), () -> {
            heartbeats.add(clock.instant());
            return null;
        });
        worker.start();

        String now = sendEmail.apply(Map.of("to", "a@x.com", "subject", "hi"));
        String later = sendEmail.applyAfter(Map.of("to", "b@x.com", "subject", "hi"), Duration.ofSeconds(7));
        String byName = worker.apply("send_email", Map.of("to", "c@x.com", "subject", "hi"), T0);
        assertThrows(UnknownTaskException.class, () -> worker.apply("nope", Map.of(), T0));

        // default poll interval is 5s, one job per tick
        engine.advance(Duration.ofSeconds(5));
        assertEquals(List.of("a@x.com"), delivered);

        engine.advance(Duration.ofSeconds(5));
        assertEquals(List.of("a@x.com", "c@x.com"), delivered);

        engine.advance(Duration.ofSeconds(5));
        assertEquals(List.of("a@x.com", "c@x.com", "b@x.com"), delivered);

        for (String id : List.of(now, later, byName)) {
            ScheduledJob job = worker.jobStore().findById(id).orElseThrow();
            assertEquals(JobStatus.COMPLETED, job.status());
            assertEquals("{\"ok\":true}", job.result());
        }

        assertEquals(List.of(T0.plusSeconds(5), T0.plusSeconds(10), T0.plusSeconds(15)), heartbeats);
        List<ExecutionRecord> records = worker.jobStore().findExecutions("heartbeat", 10);
        assertEquals(3, records.size());
    }

    @Test
    void dispatcherKeepsPollingAfterHandlerThrowsError() throws Exception {
        CountDownLatch goodRan = new CountDownLatch(1);
        try (TaskWorker live = new TaskWorker(Clock.systemUTC(), ExecutionScope.direct(),
                new ExecutorSchedulingEngine(Clock.systemUTC()))) {
            live.init(WorkerConfig.fromProperties(h2Config()).withPollInterval(Duration.ofMillis(50)));
            live.defineTask("bad", args -> {
                throw new AssertionError("bad state");
            });
            live.defineTask("good", args -> {
                goodRan.countDown();
                return null;
            });
            live.start();

            String bad = live.apply("bad", Map.of(), Instant.now());
            Thread.sleep(300);
            String good = live.apply("good", Map.of(), Instant.now());

            assertTrue(goodRan.await(5, TimeUnit.SECONDS));
            ScheduledJob failed = live.jobStore().findById(bad).orElseThrow();
            assertEquals(JobStatus.FAILED, failed.status());
            assertEquals("bad state", failed.failMessage());
            assertNotNull(live.jobStore().findById(good).orElseThrow());
        }
    }
}
