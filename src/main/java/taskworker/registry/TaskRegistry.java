package taskworker.registry;

import taskworker.exception.DuplicateTaskException;
import taskworker.exception.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to handler mapping for deferred tasks.
 * Written during startup wiring, frozen when the worker starts, read-only
 * afterwards.
 */
public final class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, RegisteredTask> tasks = new LinkedHashMap<>();
    private volatile boolean frozen = false;

    /**
     * @throws DuplicateTaskException if the name is taken
     * @throws IllegalStateException  if the registry is frozen
     */
    public synchronized RegisteredTask register(String name, TaskSignature signature, TaskHandler handler) {
        if (frozen) {
            throw new IllegalStateException("Cannot register task " + name + " after the worker has started");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (tasks.containsKey(name)) {
            throw new DuplicateTaskException(name);
        }

        RegisteredTask task = new RegisteredTask(name, signature, handler);
        tasks.put(name, task);
        log.info("Registered task {}{}", name, signature);
        return task;
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @throws UnknownTaskException if no task has this name
     */
    public RegisteredTask resolve(String name) {
        RegisteredTask task = lookup(name);
        if (task == null) {
            throw new UnknownTaskException(name);
        }
        return task;
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Set<String> names() {
        if (frozen) {
            return Collections.unmodifiableSet(tasks.keySet());
        }
        synchronized (this) {
            return Set.copyOf(tasks.keySet());
        }
    }

    /**
     * Resolve, check the payload against the signature, run the handler.
     *
     * @throws UnknownTaskException                        if no task has this name
     * @throws taskworker.exception.InvalidPayloadException if the payload does not fit
     * @throws Exception                                   whatever the handler throws
     */
    public Object invoke(String name, Map<String, Object> payload) throws Exception {
        RegisteredTask task = resolve(name);
        Map<String, Object> args = payload != null ? payload : Map.of();
        task.signature().validate(name, args);
        return task.handler().execute(args);
    }

    private RegisteredTask lookup(String name) {
        // no lock once frozen; the map is never written again
        if (frozen) {
            return tasks.get(name);
        }
        synchronized (this) {
            return tasks.get(name);
        }
    }
}
