package taskworker.trigger;

import taskworker.exception.DuplicateTaskException;
import taskworker.exception.InvalidTriggerException;
import taskworker.model.TriggerKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void intervalFiresOnePeriodAfterStart() {
        IntervalTrigger trigger = new IntervalTrigger(Duration.ofSeconds(5));

        assertEquals(TriggerKind.INTERVAL, trigger.kind());
        assertEquals(Duration.ofSeconds(5), trigger.period());
        assertEquals(T0.plusSeconds(5), trigger.firstFireTime(T0).orElseThrow());
        assertEquals(T0.plusSeconds(10), trigger.nextFireTime(T0.plusSeconds(5)).orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(Duration.ZERO));
    }

    @Test
    void dateFiresOnce() {
        DateTrigger trigger = DateSchedule.at(T0.plusSeconds(30)).toTrigger(ZoneOffset.UTC);

        assertEquals(T0.plusSeconds(30), trigger.firstFireTime(T0).orElseThrow());
        assertTrue(trigger.nextFireTime(T0.plusSeconds(30)).isEmpty());
    }

    @Test
    void missingDateFiresAtStart() {
        assertEquals(T0, DateSchedule.now().toTrigger(ZoneOffset.UTC).firstFireTime(T0).orElseThrow());
    }

    @Test
    void missedDateIsSkipped() {
        assertTrue(DateSchedule.at(T0.minusSeconds(3600)).toTrigger(ZoneOffset.UTC).firstFireTime(T0).isEmpty());
        assertTrue(DateSchedule.at(T0.minusSeconds(2)).toTrigger(ZoneOffset.UTC).firstFireTime(T0).isEmpty());
    }

    @Test
    void dateJustPassedStillFires() {
        assertEquals(T0, DateSchedule.at(T0.minusMillis(500)).toTrigger(ZoneOffset.UTC)
                .firstFireTime(T0).orElseThrow());
        assertEquals(T0, DateSchedule.at(T0.minusSeconds(1)).toTrigger(ZoneOffset.UTC)
                .firstFireTime(T0).orElseThrow());
    }

    @Test
    void localDateUsesScheduleOrDefaultZone() {
        LocalDateTime local = LocalDateTime.of(2024, 1, 1, 12, 0);

        assertEquals(Instant.parse("2024-01-01T11:00:00Z"),
                DateSchedule.at(local).toTrigger(ZoneId.of("Europe/Berlin")).runDate());
        assertEquals(Instant.parse("2024-01-01T12:00:00Z"),
                DateSchedule.at(local).timezone(ZoneOffset.UTC).toTrigger(ZoneId.of("Europe/Berlin")).runDate());
    }

    @Test
    void tableRejectsDuplicatesAndInvalidTriggers() {
        TriggerTable table = new TriggerTable();
        ScheduledAction action = () -> null;

        table.add("heartbeat", CronSchedule.create().second("*/5")::toTrigger, action);

        assertThrows(DuplicateTaskException.class,
                () -> table.add("heartbeat", DateSchedule.now()::toTrigger, action));
        assertThrows(InvalidTriggerException.class,
                () -> table.add("broken", CronSchedule.create().minute("75")::toTrigger, action));
        assertEquals(1, table.size());
    }

    @Test
    void freezeBuildsTriggersInDefaultZone() {
        TriggerTable table = new TriggerTable();
        table.add("nightly", CronSchedule.create().hour("3")::toTrigger, () -> null);
        table.add("once", DateSchedule.now()::toTrigger, () -> null);

        List<TriggerRegistration> regs = table.freeze(ZoneId.of("Europe/Berlin"));

        assertTrue(table.isFrozen());
        assertEquals(2, regs.size());
        assertEquals("nightly", regs.get(0).name());
        assertEquals(TriggerKind.CRON, regs.get(0).kind());
        assertEquals(ZoneId.of("Europe/Berlin"), ((CronTrigger) regs.get(0).trigger()).zone());
        assertEquals(TriggerKind.DATE, regs.get(1).kind());
        assertThrows(IllegalStateException.class,
                () -> table.add("late", DateSchedule.now()::toTrigger, () -> null));
    }
}
