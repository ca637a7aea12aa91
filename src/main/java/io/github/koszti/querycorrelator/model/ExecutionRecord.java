package io.github.koszti.querycorrelator.model;

import java.util.Objects;

/**
 * What one channel observed about one execution of a query.
 * <p>
 * All timestamps are epoch milliseconds. The duration is always derived as {@code end - start};
 * a server-reported duration is carried separately in {@link #getReportedDurationMillis()} and
 * is never used for comparisons.
 * <p>
 * Each logical query produces one record per channel. Records are immutable and are only ever
 * combined by the comparator.
 */
public final class ExecutionRecord
{
    private final ExecutionOrigin origin;
    private final String identifier;
    private final ExecutionStatus status;
    private final Long observedStartMillis;
    private final Long observedEndMillis;
    private final Long drainEndMillis;
    private final Long reportedDurationMillis;
    private final Long rowCount;
    private final Integer columnCount;
    private final Integer chunkCount;
    private final String errorDetail;
    private final TimingEndpoints timingEndpoints;

    private ExecutionRecord(Builder b) {
        this.origin = Objects.requireNonNull(b.origin, "origin must not be null");
        this.identifier = b.identifier == null ? "" : b.identifier;
        this.status = b.status == null ? ExecutionStatus.UNKNOWN : b.status;
        this.observedStartMillis = b.observedStartMillis;
        this.observedEndMillis = b.observedEndMillis;
        this.drainEndMillis = b.drainEndMillis;
        this.reportedDurationMillis = b.reportedDurationMillis;
        this.rowCount = b.rowCount;
        this.columnCount = b.columnCount;
        this.chunkCount = b.chunkCount;
        this.errorDetail = b.errorDetail;
        this.timingEndpoints = b.timingEndpoints == null ? TimingEndpoints.NONE : b.timingEndpoints;
    }

    public static Builder builder(ExecutionOrigin origin) {
        return new Builder(origin);
    }

    public Builder toBuilder() {
        return new Builder(origin)
                .identifier(identifier)
                .status(status)
                .observedStartMillis(observedStartMillis)
                .observedEndMillis(observedEndMillis)
                .drainEndMillis(drainEndMillis)
                .reportedDurationMillis(reportedDurationMillis)
                .rowCount(rowCount)
                .columnCount(columnCount)
                .chunkCount(chunkCount)
                .errorDetail(errorDetail)
                .timingEndpoints(timingEndpoints);
    }

    public ExecutionOrigin getOrigin() {
        return origin;
    }

    /**
     * Channel-specific identifier, empty when none was assigned.
     */
    public String getIdentifier() {
        return identifier;
    }

    public boolean hasIdentifier() {
        return !identifier.isEmpty();
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Long getObservedStartMillis() {
        return observedStartMillis;
    }

    public Long getObservedEndMillis() {
        return observedEndMillis;
    }

    /**
     * End of the full result drain. Only the primary channel records it.
     */
    public Long getDrainEndMillis() {
        return drainEndMillis;
    }

    public Long getReportedDurationMillis() {
        return reportedDurationMillis;
    }

    /**
     * {@code end - start}, or null when either endpoint is missing.
     */
    public Long getDurationMillis() {
        if (observedStartMillis == null || observedEndMillis == null) {
            return null;
        }
        return observedEndMillis - observedStartMillis;
    }

    /**
     * {@code drainEnd - start}, or null when the record has no drain time.
     */
    public Long getDrainDurationMillis() {
        if (observedStartMillis == null || drainEndMillis == null) {
            return null;
        }
        return drainEndMillis - observedStartMillis;
    }

    public Long getRowCount() {
        return rowCount;
    }

    public Integer getColumnCount() {
        return columnCount;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public TimingEndpoints getTimingEndpoints() {
        return timingEndpoints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionRecord that)) {
            return false;
        }
        return origin == that.origin
                && identifier.equals(that.identifier)
                && status == that.status
                && Objects.equals(observedStartMillis, that.observedStartMillis)
                && Objects.equals(observedEndMillis, that.observedEndMillis)
                && Objects.equals(drainEndMillis, that.drainEndMillis)
                && Objects.equals(reportedDurationMillis, that.reportedDurationMillis)
                && Objects.equals(rowCount, that.rowCount)
                && Objects.equals(columnCount, that.columnCount)
                && Objects.equals(chunkCount, that.chunkCount)
                && Objects.equals(errorDetail, that.errorDetail)
                && timingEndpoints.equals(that.timingEndpoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, identifier, status, observedStartMillis, observedEndMillis, drainEndMillis,
                reportedDurationMillis, rowCount, columnCount, chunkCount, errorDetail, timingEndpoints);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{origin=" + origin
                + ", identifier='" + identifier + '\''
                + ", status=" + status
                + ", durationMillis=" + getDurationMillis()
                + ", rowCount=" + rowCount
                + ", columnCount=" + columnCount
                + ", endpoints=" + timingEndpoints
                + (errorDetail != null ? ", error='" + errorDetail + '\'' : "")
                + '}';
    }

    public static final class Builder {
        private final ExecutionOrigin origin;
        private String identifier;
        private ExecutionStatus status;
        private Long observedStartMillis;
        private Long observedEndMillis;
        private Long drainEndMillis;
        private Long reportedDurationMillis;
        private Long rowCount;
        private Integer columnCount;
        private Integer chunkCount;
        private String errorDetail;
        private TimingEndpoints timingEndpoints;

        private Builder(ExecutionOrigin origin) {
            this.origin = origin;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder observedStartMillis(Long observedStartMillis) {
            this.observedStartMillis = observedStartMillis;
            return this;
        }

        public Builder observedEndMillis(Long observedEndMillis) {
            this.observedEndMillis = observedEndMillis;
            return this;
        }

        public Builder drainEndMillis(Long drainEndMillis) {
            this.drainEndMillis = drainEndMillis;
            return this;
        }

        public Builder reportedDurationMillis(Long reportedDurationMillis) {
            this.reportedDurationMillis = reportedDurationMillis;
            return this;
        }

        public Builder rowCount(Long rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder columnCount(Integer columnCount) {
            this.columnCount = columnCount;
            return this;
        }

        public Builder chunkCount(Integer chunkCount) {
            this.chunkCount = chunkCount;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder timingEndpoints(TimingEndpoints timingEndpoints) {
            this.timingEndpoints = timingEndpoints;
            return this;
        }

        public ExecutionRecord build() {
            return new ExecutionRecord(this);
        }
    }
}
