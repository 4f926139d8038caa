package taskworker.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable durable record of one deferred task invocation.
 */
public final class ScheduledJob {
    private final String id;
    private final String taskName;
    private final Map<String, Object> payload;
    private final JobStatus status;
    private final Instant scheduledDate;
    private final long enqueueSeq;
    private final String result; // JSON of the handler return value
    private final String failMessage;
    private final int attempts;
    private final Instant claimedAt;
    private final Instant createdAt;
    private final Instant finishedAt;

    private ScheduledJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName is required");
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.scheduledDate = Objects.requireNonNull(builder.scheduledDate, "scheduledDate is required");
        this.enqueueSeq = builder.enqueueSeq;
        this.result = builder.result;
        this.failMessage = builder.failMessage;
        this.attempts = builder.attempts;
        this.claimedAt = builder.claimedAt;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String taskName() {
        return taskName;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public JobStatus status() {
        return status;
    }

    public Instant scheduledDate() {
        return scheduledDate;
    }

    public long enqueueSeq() {
        return enqueueSeq;
    }

    public String result() {
        return result;
    }

    public String failMessage() {
        return failMessage;
    }

    public int attempts() {
        return attempts;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** True when the job may be claimed at the given instant */
    public boolean isDue(Instant now) {
        return !scheduledDate.isAfter(now);
    }

    /** Check if job is in a terminal state for its current attempt */
    public boolean isFinished() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskName;
        private Map<String, Object> payload = Map.of();
        private JobStatus status = JobStatus.PENDING;
        private Instant scheduledDate;
        private long enqueueSeq;
        private String result;
        private String failMessage;
        private int attempts;
        private Instant claimedAt;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload != null ? payload : Map.of();
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder scheduledDate(Instant scheduledDate) {
            this.scheduledDate = scheduledDate;
            return this;
        }

        public Builder enqueueSeq(long enqueueSeq) {
            this.enqueueSeq = enqueueSeq;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder failMessage(String failMessage) {
            this.failMessage = failMessage;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id='" + id + "', task='" + taskName + "', status=" + status
                + ", scheduledDate=" + scheduledDate + "}";
    }
}
