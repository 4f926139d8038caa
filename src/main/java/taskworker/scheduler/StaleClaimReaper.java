package taskworker.scheduler;

import taskworker.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Background task that fails jobs left RUNNING by a dispatcher that died
 * mid-run.
 *
 * A job claimed longer ago than the threshold is marked FAILED rather than
 * returned to PENDING: its handler may already have had side effects, so it
 * only runs again if someone resubmits it.
 */
public class StaleClaimReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleClaimReaper.class);

    private final JobStore jobStore;
    private final Duration threshold;
    private final Clock clock;

    public StaleClaimReaper(JobStore jobStore, Duration threshold, Clock clock) {
        this.jobStore = jobStore;
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStaleClaims();
        } catch (Exception e) {
            log.error("Stale claim reaper error", e);
        }
    }

    /**
     * @return number of jobs failed
     */
    public int reapStaleClaims() {
        Instant cutoff = clock.instant().minus(threshold);
        int failed = jobStore.failStaleClaims(cutoff);

        if (failed == 0) {
            log.debug("No stale claims found");
        } else {
            log.warn("Stale claim reaper: {} job(s) claimed before {} marked FAILED", failed, cutoff);
        }
        return failed;
    }
}
