package io.github.koszti.querycorrelator.model;

import java.util.Objects;

/**
 * Names of the two points in time a record's duration was computed from.
 * Server-side durations can end at compilation end, execution end or result-transfer end,
 * so every record says which pair it used.
 */
public record TimingEndpoints(String start, String end) {

    public static final TimingEndpoints PRIMARY_RESULT_HANDLE =
            new TimingEndpoints("client_submit", "client_result_handle");
    public static final TimingEndpoints CLIENT_ROUND_TRIP =
            new TimingEndpoints("client_request_sent", "client_terminal_response");
    public static final TimingEndpoints NONE = new TimingEndpoints("none", "none");

    public TimingEndpoints {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    @Override
    public String toString() {
        return start + " -> " + end;
    }
}
