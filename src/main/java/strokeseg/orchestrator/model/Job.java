package strokeseg.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one submission to the external batch scheduler.
 * The external id is null only for jobs whose submission never reached the scheduler.
 */
public final class Job {
    private final String id;
    private final String externalId;
    private final JobType jobType;
    private final JobStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final String submissionArtifact; // rendered script, kept for audit/replay
    private final int unknownObservations;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.submissionArtifact = Objects.requireNonNull(builder.submissionArtifact, "submissionArtifact is required");
        this.externalId = builder.externalId;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errorMessage = builder.errorMessage;
        this.unknownObservations = builder.unknownObservations;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String externalId() {
        return externalId;
    }

    public JobType jobType() {
        return jobType;
    }

    public JobStatus status() {
        return status;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String submissionArtifact() {
        return submissionArtifact;
    }

    public int unknownObservations() {
        return unknownObservations;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Jobs the monitors may poll: reached the scheduler and not finished yet. */
    public boolean isMonitorable() {
        return externalId != null && !isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .externalId(externalId)
                .jobType(jobType)
                .status(status)
                .startTime(startTime)
                .endTime(endTime)
                .errorMessage(errorMessage)
                .submissionArtifact(submissionArtifact)
                .unknownObservations(unknownObservations)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String externalId;
        private JobType jobType;
        private JobStatus status = JobStatus.PENDING;
        private Instant startTime;
        private Instant endTime;
        private String errorMessage;
        private String submissionArtifact;
        private int unknownObservations;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder submissionArtifact(String submissionArtifact) {
            this.submissionArtifact = submissionArtifact;
            return this;
        }

        public Builder unknownObservations(int unknownObservations) {
            this.unknownObservations = unknownObservations;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', type=" + jobType + ", externalId=" + externalId + ", status=" + status + "}";
    }
}
