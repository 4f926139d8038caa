package taskworker.registry;

/**
 * Name, signature and handler of one registered task.
 */
public record RegisteredTask(String name, TaskSignature signature, TaskHandler handler) {
}
