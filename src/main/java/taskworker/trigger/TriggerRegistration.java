package taskworker.trigger;

import taskworker.model.TriggerKind;

/**
 * A cron or date trigger bound to the action it fires.
 *
 * @param name    task name recorded in the execution audit
 * @param trigger fire time computation
 * @param action  zero-argument handler
 */
public record TriggerRegistration(String name, Trigger trigger, ScheduledAction action) {

    public TriggerKind kind() {
        return trigger.kind();
    }
}
