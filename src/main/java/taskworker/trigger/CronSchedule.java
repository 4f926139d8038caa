package taskworker.trigger;

import taskworker.exception.InvalidTriggerException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Calendar fields of a cron trigger.
 *
 * <p>Fields more significant than the least significant field that is set
 * default to {@code *}; less significant ones default to their minimum. With
 * only {@code hour("3")} set the trigger fires daily at 03:00:00; with only
 * {@code second("*&#47;5")} it fires every five seconds.
 *
 * <p>{@code dayOfWeek} takes 0-6 (0 is Monday) or {@code mon..sun}.
 * {@code day} accepts {@code last}. Restricting both {@code day} and
 * {@code dayOfWeek} is rejected, as is an ISO {@code week} other than {@code *}.
 */
public final class CronSchedule {

    private static final int YEAR = 0;
    private static final int MONTH = 1;
    private static final int DAY = 2;
    private static final int WEEK = 3;
    private static final int DAY_OF_WEEK = 4;
    private static final int HOUR = 5;
    private static final int MINUTE = 6;
    private static final int SECOND = 7;

    private static final String[] FIELD_NAMES = {
            "year", "month", "day", "week", "day_of_week", "hour", "minute", "second"
    };
    private static final String[] DEFAULTS = { "*", "1", "1", "*", "*", "0", "0", "0" };
    private static final String[] WEEKDAYS = { "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN" };

    private final String[] fields = new String[8];
    private Instant startDate;
    private Instant endDate;
    private ZoneId timezone;
    private Duration jitter = Duration.ZERO;

    private CronSchedule() {
    }

    public static CronSchedule create() {
        return new CronSchedule();
    }

    public CronSchedule year(String expr) {
        return set(YEAR, expr);
    }

    public CronSchedule month(String expr) {
        return set(MONTH, expr);
    }

    public CronSchedule day(String expr) {
        return set(DAY, expr);
    }

    public CronSchedule week(String expr) {
        return set(WEEK, expr);
    }

    public CronSchedule dayOfWeek(String expr) {
        return set(DAY_OF_WEEK, expr);
    }

    public CronSchedule hour(String expr) {
        return set(HOUR, expr);
    }

    public CronSchedule minute(String expr) {
        return set(MINUTE, expr);
    }

    public CronSchedule second(String expr) {
        return set(SECOND, expr);
    }

    /** No fire before this instant */
    public CronSchedule startDate(Instant startDate) {
        this.startDate = startDate;
        return this;
    }

    /** No fire after this instant */
    public CronSchedule endDate(Instant endDate) {
        this.endDate = endDate;
        return this;
    }

    public CronSchedule timezone(ZoneId timezone) {
        this.timezone = timezone;
        return this;
    }

    /** Delay each fire by a random amount up to this bound */
    public CronSchedule jitter(Duration jitter) {
        this.jitter = jitter != null ? jitter : Duration.ZERO;
        return this;
    }

    private CronSchedule set(int field, String expr) {
        if (expr != null && expr.isBlank()) {
            throw new InvalidTriggerException("Empty cron field: " + FIELD_NAMES[field]);
        }
        fields[field] = expr != null ? expr.trim() : null;
        return this;
    }

    /**
     * Validate the fields and build the trigger.
     *
     * @param defaultZone zone used when the schedule does not set one
     * @throws InvalidTriggerException on any invalid field or bound
     */
    public CronTrigger toTrigger(ZoneId defaultZone) {
        if (jitter.isNegative()) {
            throw new InvalidTriggerException("Jitter must not be negative: " + jitter);
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new InvalidTriggerException("end_date " + endDate + " is before start_date " + startDate);
        }
        ZoneId zone = timezone != null ? timezone : defaultZone;
        return new CronTrigger(toQuartzExpression(), zone, startDate, endDate, jitter);
    }

    /**
     * Quartz form: second minute hour day-of-month month day-of-week year.
     */
    String toQuartzExpression() {
        String[] resolved = resolveDefaults();

        if (!"*".equals(resolved[WEEK])) {
            throw new InvalidTriggerException("ISO week field is not supported: " + resolved[WEEK]);
        }

        boolean dayRestricted = !"*".equals(resolved[DAY]);
        boolean dowRestricted = !"*".equals(resolved[DAY_OF_WEEK]);
        if (dayRestricted && dowRestricted) {
            throw new InvalidTriggerException("day and day_of_week cannot both be restricted");
        }

        String day = dowRestricted ? "?" : translateDay(resolved[DAY]);
        String dow = dowRestricted ? translateDayOfWeek(resolved[DAY_OF_WEEK]) : "?";

        return String.join(" ",
                resolved[SECOND],
                resolved[MINUTE],
                resolved[HOUR],
                day,
                resolved[MONTH].toUpperCase(Locale.ROOT),
                dow,
                resolved[YEAR]);
    }

    private String[] resolveDefaults() {
        int remaining = 0;
        for (String f : fields) {
            if (f != null) {
                remaining++;
            }
        }

        String[] resolved = new String[fields.length];
        for (int i = 0; i < fields.length; i++) {
            if (fields[i] != null) {
                resolved[i] = fields[i];
                remaining--;
            } else if (remaining == 0) {
                resolved[i] = DEFAULTS[i];
            } else {
                resolved[i] = "*";
            }
        }
        return resolved;
    }

    private static String translateDay(String expr) {
        if ("last".equalsIgnoreCase(expr)) {
            return "L";
        }
        return expr.toUpperCase(Locale.ROOT);
    }

    private static String translateDayOfWeek(String expr) {
        StringBuilder out = new StringBuilder();
        for (String part : expr.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            String base = part.trim();
            int slash = base.indexOf('/');
            if (slash >= 0) {
                // Quartz counts weekdays from Sunday, so steps are spelled out by name
                out.append(expandStep(base.substring(0, slash), base.substring(slash + 1)));
            } else if ("*".equals(base)) {
                out.append('*');
            } else {
                int dash = base.indexOf('-');
                if (dash > 0) {
                    out.append(WEEKDAYS[weekday(base.substring(0, dash))])
                            .append('-')
                            .append(WEEKDAYS[weekday(base.substring(dash + 1))]);
                } else {
                    out.append(WEEKDAYS[weekday(base)]);
                }
            }
        }
        return out.toString();
    }

    private static String expandStep(String range, String stepToken) {
        int step;
        try {
            step = Integer.parseInt(stepToken.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTriggerException("Invalid day_of_week step: " + stepToken);
        }
        if (step < 1) {
            throw new InvalidTriggerException("Invalid day_of_week step: " + stepToken);
        }

        int first = 0;
        int last = WEEKDAYS.length - 1;
        if (!"*".equals(range.trim())) {
            int dash = range.indexOf('-');
            if (dash > 0) {
                first = weekday(range.substring(0, dash));
                last = weekday(range.substring(dash + 1));
            } else {
                first = weekday(range);
            }
        }
        if (first > last) {
            throw new InvalidTriggerException("Invalid day_of_week range: " + range);
        }

        StringBuilder days = new StringBuilder();
        for (int i = first; i <= last; i += step) {
            if (days.length() > 0) {
                days.append(',');
            }
            days.append(WEEKDAYS[i]);
        }
        return days.toString();
    }

    /** Index into {@link #WEEKDAYS}, Monday first */
    private static int weekday(String token) {
        String t = token.trim().toUpperCase(Locale.ROOT);
        if (t.length() == 1 && Character.isDigit(t.charAt(0))) {
            int n = t.charAt(0) - '0';
            if (n <= 6) {
                return n;
            }
        }
        for (int i = 0; i < WEEKDAYS.length; i++) {
            if (WEEKDAYS[i].equals(t)) {
                return i;
            }
        }
        throw new InvalidTriggerException("Invalid day_of_week value: " + token);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CronSchedule{");
        boolean first = true;
        for (int i = 0; i < fields.length; i++) {
            if (fields[i] != null) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(FIELD_NAMES[i]).append("='").append(fields[i]).append('\'');
                first = false;
            }
        }
        return sb.append('}').toString();
    }
}
