package taskworker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskworker.api.Controller;
import taskworker.api.v1.dto.JobResponse;
import taskworker.exception.StorageUnavailableException;
import taskworker.model.JobStatus;
import taskworker.model.ScheduledJob;
import taskworker.repository.JobStore;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for deferred jobs.
 *
 * GET /api/v1/jobs?status=FAILED&limit=50 - List jobs
 * GET /api/v1/jobs/{jobId} - Get one job
 * POST /api/v1/jobs/{jobId}/resubmit?at=2024-01-01T00:00:00Z - Make a FAILED job claimable again
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_RESUBMIT_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/resubmit$");

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final JobStore jobStore;
    private final Clock clock;

    public JobController(JobStore jobStore, Clock clock) {
        this.jobStore = jobStore;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOB_RESUBMIT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() ||
                    JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher resubmitMatcher = JOB_RESUBMIT_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && resubmitMatcher.matches()) {
                return handleResubmit(req, resubmitMatcher.group(1));
            }

            if (JOBS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (StorageUnavailableException e) {
            log.warn("Job store unavailable: {}", e.getMessage());
            return ControllerResponse.unavailable("job store unavailable");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/jobs - most recent jobs, or jobs in one status
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = Controller.limitParam(req, DEFAULT_LIMIT, MAX_LIMIT);
        String statusParam = Controller.queryParam(req, "status");

        List<ScheduledJob> jobs;
        if (statusParam == null || statusParam.isBlank()) {
            jobs = jobStore.findRecent(limit);
        } else {
            JobStatus status = JobStatus.valueOf(statusParam.trim().toUpperCase(Locale.ROOT));
            jobs = jobStore.findByStatus(status, limit);
        }

        List<JobResponse> items = jobs.stream()
                .map(JobResponse::from)
                .map(JobResponse::compact)
                .toList();

        Map<String, Object> response = Map.of(
                "count", items.size(),
                "jobs", items);

        return ControllerResponse.json(Jsons.toJson(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<ScheduledJob> jobOpt = jobStore.findById(jobId);

        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        return ControllerResponse.json(Jsons.toJson(JobResponse.from(jobOpt.get())));
    }

    /**
     * POST /api/v1/jobs/{jobId}/resubmit
     */
    private ControllerResponse handleResubmit(FullHttpRequest req, String jobId) throws Exception {
        Optional<ScheduledJob> jobOpt = jobStore.findById(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        Instant scheduledDate = parseInstant(Controller.queryParam(req, "at"));
        if (scheduledDate == null) {
            scheduledDate = clock.instant();
        }

        if (!jobStore.resubmit(jobId, scheduledDate)) {
            return ControllerResponse.conflict(
                    "job is " + jobOpt.get().status() + ", only FAILED jobs can be resubmitted");
        }

        log.info("Job {} resubmitted via admin API", jobId);
        ScheduledJob job = jobStore.findById(jobId).orElseThrow();
        return ControllerResponse.json(Jsons.toJson(JobResponse.from(job)));
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 instant: " + raw);
        }
    }
}
