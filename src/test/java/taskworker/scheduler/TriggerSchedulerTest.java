package taskworker.scheduler;

import taskworker.MutableClock;
import taskworker.config.BackendKind;
import taskworker.model.ExecutionRecord;
import taskworker.model.JobStatus;
import taskworker.model.TriggerKind;
import taskworker.registry.TaskRegistry;
import taskworker.registry.TaskSignature;
import taskworker.store.Database;
import taskworker.store.H2JobStore;
import taskworker.store.JdbcJobStore;
import taskworker.trigger.CronSchedule;
import taskworker.trigger.DateSchedule;
import taskworker.trigger.TriggerTable;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TriggerSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcJobStore store;

    private SimulatedSchedulingEngine engine;
    private TriggerScheduler scheduler;
    private TriggerTable triggers;
    private TaskRegistry registry;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-triggers;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE",
                BackendKind.H2, 4);
        clock = new MutableClock(T0);
        store = new H2JobStore(db, clock);
        store.createTables();
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        clock.set(T0);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM scheduled_job");
            st.execute("DELETE FROM execution_audit");
            conn.commit();
        }

        engine = new SimulatedSchedulingEngine(clock);
        scheduler = new TriggerScheduler(engine, store, ExecutionScope.direct(), clock);
        triggers = new TriggerTable();
        registry = new TaskRegistry();
    }

    @AfterEach
    void stop() {
        scheduler.shutdown();
    }

    private void start(Duration pollInterval) {
        Dispatcher dispatcher = new Dispatcher(store, registry, ExecutionScope.direct(), clock, false);
        scheduler.start(dispatcher, pollInterval, null, null, triggers.freeze(ZoneOffset.UTC));
    }

    @Test
    void cronEveryFiveSecondsRecordsEachFire() {
        AtomicInteger calls = new AtomicInteger();
        triggers.add("heartbeat", CronSchedule.create().second("*/5")::toTrigger, calls::incrementAndGet);
        start(Duration.ofHours(1));

        engine.advance(Duration.ofSeconds(12));

        assertEquals(2, calls.get());
        List<ExecutionRecord> records = store.findExecutions("heartbeat", 10);
        assertEquals(2, records.size());
        assertEquals(T0.plusSeconds(10), records.get(0).startedAt());
        assertEquals(T0.plusSeconds(5), records.get(1).startedAt());
        assertEquals(TriggerKind.CRON, records.get(0).triggerKind());
        assertEquals("2", records.get(0).output());
        assertTrue(records.get(0).succeeded());
    }

    @Test
    void dateTriggerFiresOnce() {
        AtomicInteger calls = new AtomicInteger();
        triggers.add("warmup", DateSchedule.at(T0.plusSeconds(30))::toTrigger, () -> {
            calls.incrementAndGet();
            return null;
        });
        start(Duration.ofHours(1));

        engine.advance(Duration.ofMinutes(10));

        assertEquals(1, calls.get());
        List<ExecutionRecord> records = store.findExecutions("warmup", 10);
        assertEquals(1, records.size());
        assertEquals(T0.plusSeconds(30), records.get(0).startedAt());
        assertEquals(TriggerKind.DATE, records.get(0).triggerKind());
        assertNull(records.get(0).output());
    }

    @Test
    void missedDateTriggerDoesNotFireOnRestart() {
        AtomicInteger calls = new AtomicInteger();
        triggers.add("one-shot", DateSchedule.at(T0.minusSeconds(3600))::toTrigger, () -> {
            calls.incrementAndGet();
            return null;
        });
        start(Duration.ofHours(1));

        engine.advance(Duration.ofMinutes(1));

        assertEquals(0, calls.get());
        assertEquals(0, store.countExecutions("one-shot"));
    }

    @Test
    void failingActionIsRecordedAndKeepsFiring() {
        triggers.add("broken", CronSchedule.create().second("*/5")::toTrigger, () -> {
            throw new IllegalStateException("cache offline");
        });
        start(Duration.ofHours(1));

        engine.advance(Duration.ofSeconds(15));

        List<ExecutionRecord> records = store.findExecutions("broken", 10);
        assertEquals(3, records.size());
        for (ExecutionRecord r : records) {
            assertFalse(r.succeeded());
            assertEquals("cache offline", r.failMessage());
        }
    }

    @Test
    void actionThrowingErrorIsRecordedAndKeepsFiring() {
        triggers.add("asserting", CronSchedule.create().second("*/5")::toTrigger, () -> {
            throw new AssertionError("bad state");
        });
        start(Duration.ofHours(1));

        engine.advance(Duration.ofSeconds(10));

        List<ExecutionRecord> records = store.findExecutions("asserting", 10);
        assertEquals(2, records.size());
        assertEquals("bad state", records.get(0).failMessage());
        assertFalse(records.get(1).succeeded());
    }

    @Test
    void pollIntervalDrivesDispatcher() {
        AtomicInteger runs = new AtomicInteger();
        registry.register("count", TaskSignature.none(), args -> runs.incrementAndGet());
        store.apply("count", Map.of(), T0);
        store.apply("count", Map.of(), T0);
        start(Duration.ofSeconds(5));

        engine.advance(Duration.ofSeconds(4));
        assertEquals(0, runs.get());

        engine.advance(Duration.ofSeconds(1));
        assertEquals(1, runs.get());

        engine.advance(Duration.ofSeconds(5));
        assertEquals(2, runs.get());
        assertEquals(2, store.countByStatus(JobStatus.COMPLETED));
    }

    @Test
    void registersDispatcherReaperAndTriggers() {
        triggers.add("heartbeat", CronSchedule.create().second("*/5")::toTrigger, () -> null);
        triggers.add("warmup", DateSchedule.now()::toTrigger, () -> null);
        Dispatcher dispatcher = new Dispatcher(store, registry, ExecutionScope.direct(), clock, false);
        StaleClaimReaper reaper = new StaleClaimReaper(store, Duration.ofMinutes(30), clock);

        scheduler.start(dispatcher, Duration.ofSeconds(5), reaper, Duration.ofMinutes(1),
                triggers.freeze(ZoneOffset.UTC));

        assertTrue(scheduler.isRunning());
        assertEquals(List.of("dispatcher", "stale-claim-reaper", "cron:heartbeat", "date:warmup"),
                engine.jobIds());

        scheduler.shutdown();
        assertFalse(scheduler.isRunning());
    }
}
