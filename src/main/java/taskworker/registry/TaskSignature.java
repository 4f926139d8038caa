package taskworker.registry;

import taskworker.exception.InvalidPayloadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parameter names a handler accepts.
 * A payload fits when it carries every required name and nothing else
 * besides the optional names, unless the signature accepts any extra keys.
 */
public final class TaskSignature {

    private static final TaskSignature ANY = new TaskSignature(Set.of(), Set.of(), true);
    private static final TaskSignature NONE = new TaskSignature(Set.of(), Set.of(), false);

    private final Set<String> required;
    private final Set<String> optional;
    private final boolean acceptsExtra;

    private TaskSignature(Set<String> required, Set<String> optional, boolean acceptsExtra) {
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
        this.optional = Collections.unmodifiableSet(new LinkedHashSet<>(optional));
        this.acceptsExtra = acceptsExtra;
    }

    public static TaskSignature of(String... required) {
        return new TaskSignature(new LinkedHashSet<>(List.of(required)), Set.of(), false);
    }

    /** Signature that takes no arguments */
    public static TaskSignature none() {
        return NONE;
    }

    /** Signature that accepts any payload */
    public static TaskSignature any() {
        return ANY;
    }

    public TaskSignature withOptional(String... names) {
        Set<String> opt = new LinkedHashSet<>(optional);
        opt.addAll(List.of(names));
        return new TaskSignature(required, opt, acceptsExtra);
    }

    public Set<String> required() {
        return required;
    }

    public Set<String> optional() {
        return optional;
    }

    public boolean acceptsExtra() {
        return acceptsExtra;
    }

    /**
     * @throws InvalidPayloadException naming the missing and unexpected keys
     */
    public void validate(String taskName, Map<String, Object> payload) {
        Set<String> keys = payload != null ? payload.keySet() : Set.of();

        Set<String> missing = new TreeSet<>(required);
        missing.removeAll(keys);

        Set<String> unexpected = new TreeSet<>();
        if (!acceptsExtra) {
            for (String key : keys) {
                if (!required.contains(key) && !optional.contains(key)) {
                    unexpected.add(key);
                }
            }
        }

        if (missing.isEmpty() && unexpected.isEmpty()) {
            return;
        }

        StringBuilder msg = new StringBuilder(taskName).append("() ");
        if (!missing.isEmpty()) {
            msg.append("missing required arguments: ").append(String.join(", ", missing));
        }
        if (!unexpected.isEmpty()) {
            if (!missing.isEmpty()) {
                msg.append("; ");
            }
            msg.append("got unexpected arguments: ").append(String.join(", ", unexpected));
        }
        throw new InvalidPayloadException(msg.toString());
    }

    @Override
    public String toString() {
        if (acceptsExtra) {
            return "(...)";
        }
        List<String> params = new ArrayList<>(required);
        for (String o : optional) {
            params.add(o + "=?");
        }
        return "(" + String.join(", ", params) + ")";
    }
}
