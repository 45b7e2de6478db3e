package io.jsonlogic.core.spi;

import io.jsonlogic.core.model.RelativeDelta;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;

/**
 * External date collaborator consumed by the {@code date}, {@code datetime}, {@code today} operators
 * and by date arithmetic in {@code +} / {@code -}. The engine never parses dates or performs calendar
 * arithmetic itself.
 *
 * <p>Errors raised by implementations (e.g. {@link java.time.format.DateTimeParseException}) are
 * propagated to the caller of {@code evaluate} unchanged.
 *
 * <p>Implementations MUST be thread-safe.
 */
public interface DateProvider {

    /** Parses a calendar date, e.g. {@code 2021-10-01}. */
    LocalDate parseDate(String text);

    /** Parses a date-time, e.g. {@code 2021-10-01T12:30:00}. */
    LocalDateTime parseDatetime(String text);

    /** The current date. */
    LocalDate today();

    /**
     * Returns {@code value} shifted by {@code delta}.
     *
     * @param value a {@link LocalDate} or {@link LocalDateTime} previously produced by this provider
     */
    Temporal addDelta(Temporal value, RelativeDelta delta);

    /** Whole days from {@code start} to {@code end}; negative when {@code end} is earlier. */
    long daysBetween(Temporal start, Temporal end);
}
