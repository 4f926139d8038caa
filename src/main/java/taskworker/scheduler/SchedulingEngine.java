package taskworker.scheduler;

import taskworker.trigger.Trigger;

/**
 * Fires actions at the times their triggers compute.
 */
public interface SchedulingEngine {

    /**
     * Add a job. Jobs added before {@link #start()} are armed when it is called;
     * jobs added later are armed immediately.
     *
     * @param id      name used in logs
     * @param trigger fire time computation
     * @param action  run on each fire; exceptions are logged, never propagated
     */
    void addJob(String id, Trigger trigger, Runnable action);

    void start();

    /**
     * Stop firing. In-flight actions get a grace period to finish.
     */
    void shutdown();

    /**
     * Block until {@link #shutdown()} has completed.
     */
    void awaitTermination() throws InterruptedException;

    boolean isRunning();
}
