package io.messageformat.core.function;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A date/time operand normalized to a {@link ZonedDateTime}.
 *
 * @param value    the moment; operands without a zone are placed in UTC
 * @param zoned    whether the operand named its own zone or offset
 * @param absolute whether the operand denotes an instant ({@code false} for local date-times,
 *                 which keep their wall clock time when moved to another zone)
 * @param options  options carried in by a resolved operand
 */
public record DateTimeInput(ZonedDateTime value, boolean zoned, boolean absolute, Map<String, Object> options) {

    public DateTimeInput {
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }
}
