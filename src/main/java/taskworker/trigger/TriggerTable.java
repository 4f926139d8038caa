package taskworker.trigger;

import taskworker.exception.DuplicateTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron and date triggers registered during startup wiring.
 * Read once when the scheduler starts; not persisted.
 */
public final class TriggerTable {

    private static final Logger log = LoggerFactory.getLogger(TriggerTable.class);

    private final List<Entry> entries = new ArrayList<>();
    private boolean frozen = false;

    /**
     * Register a trigger. The factory is run once here so an invalid trigger
     * fails at registration rather than at start.
     *
     * @throws taskworker.exception.InvalidTriggerException if the trigger is invalid
     * @throws DuplicateTaskException                       if the name is taken
     * @throws IllegalStateException                        once the table is frozen
     */
    public synchronized void add(String name, TriggerFactory factory, ScheduledAction action) {
        if (frozen) {
            throw new IllegalStateException("Cannot register trigger " + name + " after the worker has started");
        }
        for (Entry e : entries) {
            if (e.name.equals(name)) {
                throw new DuplicateTaskException(name);
            }
        }

        Trigger validated = factory.create(ZoneOffset.UTC);
        entries.add(new Entry(name, factory, action));
        log.info("Registered {} trigger {} {}", validated.kind(), name, validated);
    }

    /**
     * Freeze the table and build every trigger in registration order.
     */
    public synchronized List<TriggerRegistration> freeze(ZoneId defaultZone) {
        frozen = true;
        List<TriggerRegistration> out = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            out.add(new TriggerRegistration(e.name, e.factory.create(defaultZone), e.action));
        }
        return out;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    public synchronized int size() {
        return entries.size();
    }

    private record Entry(String name, TriggerFactory factory, ScheduledAction action) {
    }
}
