package io.jsonlogic.core.date;

import io.jsonlogic.core.model.RelativeDelta;
import io.jsonlogic.core.spi.DateProvider;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * Default {@link DateProvider} backed by {@code java.time}. Parses ISO-8601 text; a datetime that
 * carries an offset is converted to the provider's zone. {@link java.time.format.DateTimeParseException}
 * propagates to the caller for malformed input.
 *
 * <p>
 * Thread-safe: {@link Clock} and the ISO formatters are immutable.
 */
public final class IsoDateProvider implements DateProvider {

    private final Clock clock;

    /** Provider for the given zone, reading the system clock. */
    public IsoDateProvider(ZoneId zone) {
        this(Clock.system(zone));
    }

    /** Provider with an explicit clock; {@code today()} and offset conversion use the clock's zone. */
    public IsoDateProvider(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    @Override
    public LocalDate parseDate(String text) {
        String trimmed = text.trim();
        if (trimmed.indexOf('T') >= 0) {
            return parseDatetime(trimmed).toLocalDate();
        }
        return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
    }

    @Override
    public LocalDateTime parseDatetime(String text) {
        String trimmed = text.trim();
        if (trimmed.indexOf('T') < 0) {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
        }
        TemporalAccessor parsed =
                DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).atZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        return (LocalDateTime) parsed;
    }

    @Override
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** Applies years, then months, then days; month overflow clamps to the last day of the month. */
    @Override
    public Temporal addDelta(Temporal value, RelativeDelta delta) {
        if (value instanceof LocalDate) {
            return ((LocalDate) value)
                    .plusYears(delta.years())
                    .plusMonths(delta.months())
                    .plusDays(delta.days());
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value)
                    .plusYears(delta.years())
                    .plusMonths(delta.months())
                    .plusDays(delta.days());
        }
        throw new IllegalArgumentException("Unsupported temporal type: " + value.getClass().getName());
    }

    @Override
    public long daysBetween(Temporal start, Temporal end) {
        if (start instanceof LocalDateTime && end instanceof LocalDate) {
            return ChronoUnit.DAYS.between(((LocalDateTime) start).toLocalDate(), end);
        }
        return ChronoUnit.DAYS.between(start, end);
    }
}
