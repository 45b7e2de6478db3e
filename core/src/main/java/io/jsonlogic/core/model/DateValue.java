package io.jsonlogic.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.Objects;

/**
 * A date or datetime produced by the date operators. Serializes as ISO-8601 text, so results
 * holding dates can be printed and written by any {@code ObjectMapper}.
 *
 * @param temporal a {@link LocalDate} or {@link LocalDateTime}
 */
public record DateValue(Temporal temporal) {

    public DateValue {
        Objects.requireNonNull(temporal, "temporal must not be null");
        if (!(temporal instanceof LocalDate) && !(temporal instanceof LocalDateTime)) {
            throw new IllegalArgumentException("Unsupported temporal type: " + temporal.getClass().getName());
        }
    }

    /** {@code yyyy-MM-dd} for dates, {@code yyyy-MM-ddTHH:mm:ss} for datetimes. */
    @JsonValue
    public String isoText() {
        if (temporal instanceof LocalDateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(temporal);
        }
        return DateTimeFormatter.ISO_LOCAL_DATE.format(temporal);
    }

    @Override
    public String toString() {
        return isoText();
    }
}
