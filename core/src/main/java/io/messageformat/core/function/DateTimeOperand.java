package io.messageformat.core.function;

import io.messageformat.core.error.ErrorType;
import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.number.Numbers;
import io.messageformat.core.value.DateTimeValue;
import io.messageformat.core.value.FallbackValue;
import io.messageformat.core.value.MessageValue;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.regex.Pattern;

/**
 * Reads the operand of the date/time functions.
 *
 * <p>Accepted: {@link ZonedDateTime}, {@link OffsetDateTime}, {@link Instant}, {@link
 * LocalDateTime}, {@link LocalDate}, {@link Date}, numbers (epoch seconds), ISO-8601 strings with
 * or without an offset or zone, date-only strings, {@code yyyy-MM-dd HH:mm:ss} strings, strings of
 * epoch seconds, and resolved date/time values. Operands without a zone are placed in UTC.
 */
public final class DateTimeOperand {

    private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalStart()
            .appendLiteral('[')
            .parseCaseSensitive()
            .appendZoneRegionId()
            .appendLiteral(']')
            .optionalEnd()
            .toFormatter();

    private static final Pattern EPOCH_SECONDS = Pattern.compile("-?[0-9]+");

    private DateTimeOperand() {
        // utility class
    }

    /**
     * @throws MessageResolutionException with type {@code bad-operand} when the operand is not a
     *     date
     */
    public static DateTimeInput read(Object operand, String source) {
        if (operand instanceof DateTimeValue resolved) {
            return new DateTimeInput(resolved.valueOf(), resolved.zoned(), true, resolved.options());
        }
        if (operand instanceof FallbackValue) {
            throw notADate(source);
        }
        if (operand instanceof MessageValue resolved) {
            return read(resolved.valueOf(), source);
        }
        if (operand instanceof ZonedDateTime zoned) {
            return new DateTimeInput(zoned, true, true, null);
        }
        if (operand instanceof OffsetDateTime offset) {
            return new DateTimeInput(offset.toZonedDateTime(), true, true, null);
        }
        if (operand instanceof Instant moment) {
            return instant(moment);
        }
        if (operand instanceof Date date) {
            return instant(date.toInstant());
        }
        if (operand instanceof LocalDateTime dateTime) {
            return local(dateTime);
        }
        if (operand instanceof LocalDate date) {
            return local(date.atStartOfDay());
        }
        if (operand instanceof Number number && Numbers.isSupported(number) && Numbers.isFinite(number)) {
            return epochSeconds(Numbers.toBigDecimal(number), source);
        }
        if (operand instanceof String text) {
            return parse(text.trim(), source);
        }
        throw notADate(source);
    }

    private static DateTimeInput parse(String text, String source) {
        if (EPOCH_SECONDS.matcher(text).matches()) {
            return epochSeconds(new BigDecimal(text), source);
        }
        TemporalAccessor parsed;
        try {
            parsed = PARSER.parseBest(text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new MessageResolutionException(ErrorType.BAD_OPERAND, "Input is not a date", e, source);
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return new DateTimeInput(zoned, true, true, null);
        }
        if (parsed instanceof LocalDateTime dateTime) {
            return local(dateTime);
        }
        return local(LocalDate.from(parsed).atStartOfDay());
    }

    private static DateTimeInput epochSeconds(BigDecimal seconds, String source) {
        try {
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return instant(Instant.ofEpochSecond(whole, nanos));
        } catch (DateTimeException | ArithmeticException e) {
            throw new MessageResolutionException(ErrorType.BAD_OPERAND, "Input is not a date", e, source);
        }
    }

    private static DateTimeInput instant(Instant instant) {
        return new DateTimeInput(instant.atZone(ZoneOffset.UTC), false, true, null);
    }

    private static DateTimeInput local(LocalDateTime dateTime) {
        return new DateTimeInput(dateTime.atZone(ZoneOffset.UTC), false, false, null);
    }

    private static MessageResolutionException notADate(String source) {
        return MessageResolutionException.badOperand("Input is not a date", source);
    }
}
