package adcp.workflow.adapter;

import java.time.Instant;
import java.util.Objects;

public record DateRange(Instant start, Instant end) {
    public DateRange {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }
}
