package resmon.monitor.model;

import java.util.Objects;

/**
 * A named, recurring probe: run {@link JobConfig} every {@code intervalSeconds}.
 */
public final class ProbeDefinition {
    private final String name;
    private final boolean enabled;
    private final long intervalSeconds;
    private final JobConfig jobConfig;

    private ProbeDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.jobConfig = Objects.requireNonNull(builder.jobConfig, "jobConfig is required");
        if (builder.intervalSeconds <= 0) {
            throw new IllegalArgumentException("interval of probe " + name + " must be positive");
        }
        this.enabled = builder.enabled;
        this.intervalSeconds = builder.intervalSeconds;
    }

    public String name() {
        return name;
    }

    public boolean enabled() {
        return enabled;
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }

    public JobConfig jobConfig() {
        return jobConfig;
    }

    public long timeoutSeconds() {
        return jobConfig.timeout();
    }

    /** Instances of this probe that can overlap when each runs up to its timeout. */
    public long maxOverlap() {
        return (timeoutSeconds() + intervalSeconds - 1) / intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private boolean enabled = true;
        private long intervalSeconds;
        private JobConfig jobConfig;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public Builder jobConfig(JobConfig jobConfig) {
            this.jobConfig = jobConfig;
            return this;
        }

        public ProbeDefinition build() {
            return new ProbeDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProbeDefinition that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ProbeDefinition{name='" + name + "', interval=" + intervalSeconds
                + "s, timeout=" + timeoutSeconds() + "s, enabled=" + enabled + "}";
    }
}
