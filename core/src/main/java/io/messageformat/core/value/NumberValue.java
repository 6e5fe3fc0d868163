package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.error.MessageSelectionException;
import io.messageformat.core.number.FormattedNumber;
import io.messageformat.core.number.NumberFormatter;
import io.messageformat.core.number.NumberOptions;
import io.messageformat.core.number.NumberSelector;
import io.messageformat.core.part.MessagePart;
import io.messageformat.core.part.NumberPart;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A number with its resolved formatting options. The style in the options drives both the
 * rendering and the value used for selection; {@link #valueOf()} returns the number as given.
 */
public final class NumberValue implements MessageValue {

    private final Number value;
    private final String locale;
    private final String source;
    private final Direction dir;
    private final Map<String, Object> options;
    private final NumberOptions numberOptions;
    private final boolean canSelect;

    public NumberValue(Number value, String locale, String source, Map<String, Object> options) {
        this(value, locale, source, Direction.AUTO, options, true);
    }

    public NumberValue(
            Number value,
            String locale,
            String source,
            Direction dir,
            Map<String, Object> options,
            boolean canSelect) {
        this.value = Objects.requireNonNull(value, "value");
        this.locale = locale != null ? locale : "";
        this.source = source != null ? source : "";
        this.dir = dir != null ? dir : Direction.AUTO;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
        this.numberOptions = NumberOptions.from(this.options);
        this.canSelect = canSelect;
    }

    @Override
    public String type() {
        return "number";
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Direction dir() {
        return dir;
    }

    @Override
    public String locale() {
        return locale;
    }

    @Override
    public Map<String, Object> options() {
        return options;
    }

    /** Typed view of {@link #options()}. */
    public NumberOptions numberOptions() {
        return numberOptions;
    }

    @Override
    public String toString() {
        return format().text();
    }

    @Override
    public List<MessagePart> toParts() {
        FormattedNumber number = format();
        return List.of(new NumberPart(number.text(), source, locale, dir, number.parts()));
    }

    @Override
    public Number valueOf() {
        return value;
    }

    @Override
    public boolean selectable() {
        return canSelect;
    }

    @Override
    public List<String> selectKeys(List<String> keys) {
        if (!canSelect) {
            throw MessageSelectionException.notSelectable(type());
        }
        return NumberSelector.selectKeys(value, numberOptions, locale, keys);
    }

    private FormattedNumber format() {
        return NumberFormatter.format(value, locale, numberOptions);
    }
}
