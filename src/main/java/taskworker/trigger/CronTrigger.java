package taskworker.trigger;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import taskworker.exception.InvalidTriggerException;
import taskworker.model.TriggerKind;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Calendar trigger evaluated by cron-utils against a Quartz expression.
 * Built from {@link CronSchedule}.
 */
public final class CronTrigger implements Trigger {

    private static final CronDefinition QUARTZ = CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ);

    private final String expression;
    private final ExecutionTime executionTime;
    private final ZoneId zone;
    private final Instant startDate;
    private final Instant endDate;
    private final Duration jitter;

    CronTrigger(String expression, ZoneId zone, Instant startDate, Instant endDate, Duration jitter) {
        this.expression = expression;
        this.zone = zone;
        this.startDate = startDate;
        this.endDate = endDate;
        this.jitter = jitter;

        try {
            Cron cron = new CronParser(QUARTZ).parse(expression);
            cron.validate();
            this.executionTime = ExecutionTime.forCron(cron);
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * Parse a raw Quartz expression.
     */
    public static CronTrigger fromExpression(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidTriggerException("cron expression is required");
        }
        return new CronTrigger(expression.trim(), zone, null, null, Duration.ZERO);
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public TriggerKind kind() {
        return TriggerKind.CRON;
    }

    @Override
    public Optional<Instant> firstFireTime(Instant now) {
        Instant base = now;
        if (startDate != null && startDate.isAfter(now)) {
            // fires fall on whole seconds, one exactly at the start date counts
            Instant start = startDate.truncatedTo(ChronoUnit.SECONDS);
            if (start.isBefore(startDate)) {
                start = start.plusSeconds(1);
            }
            base = start.minusSeconds(1);
        }
        return nextAfter(base);
    }

    @Override
    public Optional<Instant> nextFireTime(Instant previous) {
        return nextAfter(previous);
    }

    @Override
    public Duration jitter() {
        return jitter;
    }

    private Optional<Instant> nextAfter(Instant base) {
        ZonedDateTime from = ZonedDateTime.ofInstant(base, zone);
        Optional<Instant> next = executionTime.nextExecution(from).map(ZonedDateTime::toInstant);
        if (next.isPresent() && !next.get().isAfter(base)) {
            next = executionTime.nextExecution(from.plusSeconds(1)).map(ZonedDateTime::toInstant);
        }
        if (next.isPresent() && endDate != null && next.get().isAfter(endDate)) {
            return Optional.empty();
        }
        return next;
    }

    @Override
    public String toString() {
        return "cron[" + expression + " " + zone + "]";
    }
}
