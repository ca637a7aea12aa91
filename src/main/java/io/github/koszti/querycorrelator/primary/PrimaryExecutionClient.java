package io.github.koszti.querycorrelator.primary;

import io.github.koszti.querycorrelator.exception.ExecutionFailedException;
import io.github.koszti.querycorrelator.model.ExecutionOrigin;
import io.github.koszti.querycorrelator.model.ExecutionRecord;
import io.github.koszti.querycorrelator.model.ExecutionStatus;
import io.github.koszti.querycorrelator.model.QueryRequest;
import io.github.koszti.querycorrelator.model.TimingEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;

/**
 * Runs a query through the {@link PrimaryChannel} and times it.
 * <p>
 * The record's duration ends when the channel hands back a result handle; the full drain time
 * is recorded separately as {@link ExecutionRecord#getDrainDurationMillis()}. Results are always
 * drained completely so the remote statement is released and rows can be counted.
 */
@Service
public class PrimaryExecutionClient
{
    private static final Logger log = LoggerFactory.getLogger(PrimaryExecutionClient.class);

    private final PrimaryChannel channel;
    private final Clock clock;

    public PrimaryExecutionClient(PrimaryChannel channel, Clock clock) {
        this.channel = channel;
        this.clock = clock;
    }

    public ExecutionRecord execute(QueryRequest request) throws ExecutionFailedException {
        Objects.requireNonNull(request, "request must not be null");

        IdentifierSlot slot = new IdentifierSlot();
        long start = clock.millis();
        Long handleAt = null;
        Integer columns = null;
        long rows = 0;

        try (PrimaryResultHandle handle = channel.submit(request, slot)) {
            handleAt = clock.millis();
            columns = handle.getColumnCount();
            while (handle.next()) {
                rows++;
            }
        } catch (SQLException | RuntimeException e) {
            long failedAt = clock.millis();
            CapturedIdentifier id = slot.seal();
            ExecutionRecord failed = ExecutionRecord.builder(ExecutionOrigin.PRIMARY)
                    .identifier(id.value())
                    .status(ExecutionStatus.FAILED)
                    .observedStartMillis(start)
                    .observedEndMillis(handleAt != null ? handleAt : failedAt)
                    .drainEndMillis(handleAt != null ? failedAt : null)
                    .rowCount(handleAt != null ? rows : null)
                    .columnCount(columns)
                    .errorDetail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .timingEndpoints(TimingEndpoints.PRIMARY_RESULT_HANDLE)
                    .build();
            log.warn("Primary execution failed. id={}, error={}", id.isEmpty() ? "(none)" : id.value(), e.toString());
            throw new ExecutionFailedException("Primary execution failed: " + failed.getErrorDetail(), failed, e);
        }

        long drainEnd = clock.millis();
        CapturedIdentifier id = slot.seal();
        ExecutionRecord record = ExecutionRecord.builder(ExecutionOrigin.PRIMARY)
                .identifier(id.value())
                .status(ExecutionStatus.SUCCEEDED)
                .observedStartMillis(start)
                .observedEndMillis(handleAt)
                .drainEndMillis(drainEnd)
                .rowCount(rows)
                .columnCount(columns)
                .timingEndpoints(TimingEndpoints.PRIMARY_RESULT_HANDLE)
                .build();

        log.info("Primary execution finished. id={}, handleMs={}, drainMs={}, rows={}, columns={}",
                id.isEmpty() ? "(none)" : id.value(),
                record.getDurationMillis(), record.getDrainDurationMillis(), rows, columns);
        return record;
    }
}
