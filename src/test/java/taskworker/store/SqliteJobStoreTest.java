package taskworker.store;

import taskworker.MutableClock;
import taskworker.config.BackendKind;
import taskworker.model.CompleteResult;
import taskworker.model.JobStatus;
import taskworker.model.ScheduledJob;
import taskworker.repository.JobStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Embedded file backend.
 */
class SqliteJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path dir;

    private Database db;
    private JobStore store;

    @BeforeEach
    void setup() {
        db = new Database("jdbc:sqlite:" + dir.resolve("tasker.db"), BackendKind.SQLITE, 4);
        store = JobStores.create(db, new MutableClock(T0));
        store.createTables();
    }

    @AfterEach
    void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void selectsSqliteStore() {
        assertInstanceOf(SqliteJobStore.class, store);
    }

    @Test
    void connectionsUseWalJournal() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement();
                ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
            assertTrue(rs.next());
            assertEquals("wal", rs.getString(1).toLowerCase());
            conn.commit();
        }
    }

    @Test
    void lifecycle() {
        String early = store.apply("t", Map.of("n", 1), T0.minusSeconds(5));
        String late = store.apply("t", Map.of("n", 2), T0);
        String future = store.apply("t", Map.of("n", 3), T0.plusSeconds(5));

        ScheduledJob first = store.claimNext(T0).orElseThrow();
        assertEquals(early, first.id());
        assertEquals(1, first.payload().get("n"));
        assertEquals(JobStatus.RUNNING, first.status());

        assertEquals(CompleteResult.COMPLETED, store.complete(first, "{\"ok\":true}"));
        assertEquals(CompleteResult.ALREADY_FINISHED, store.complete(first, null));

        assertEquals(late, store.claimNext(T0).orElseThrow().id());
        assertTrue(store.claimNext(T0).isEmpty());
        assertTrue(store.claimNext(T0.plusSeconds(5).minusMillis(1)).isEmpty());
        assertEquals(future, store.claimNext(T0.plusSeconds(5)).orElseThrow().id());
    }

    @Test
    void concurrentClaimsWithConcurrentProducers() throws Exception {
        int jobs = 20;
        for (int i = 0; i < jobs; i++) {
            store.apply("t", Map.of("n", i), T0);
        }

        Set<String> claimed = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            for (int i = 0; i < 4; i++) {
                pool.submit(() -> {
                    while (true) {
                        var job = store.claimNext(T0);
                        if (job.isEmpty()) {
                            return null;
                        }
                        assertTrue(claimed.add(job.get().id()), "claimed twice: " + job.get().id());
                    }
                });
            }
            for (int i = 0; i < 2; i++) {
                pool.submit(() -> store.apply("t", Map.of(), T0.plusSeconds(60)));
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        assertEquals(jobs, new HashSet<>(claimed).size());
        assertEquals(jobs, store.countByStatus(JobStatus.RUNNING));
        assertEquals(2, store.countByStatus(JobStatus.PENDING));
    }
}
