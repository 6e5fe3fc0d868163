package io.messageformat.core.value;

import io.messageformat.core.bidi.Direction;
import io.messageformat.core.part.MessagePart;
import io.messageformat.core.part.StringPart;
import java.text.Normalizer;
import java.util.List;
import java.util.Objects;

/** A string. Selection is an exact match after NFC normalization of both sides. */
public final class StringValue implements MessageValue {

    private final String value;
    private final String locale;
    private final String source;
    private final Direction dir;

    public StringValue(String value, String locale, String source) {
        this(value, locale, source, Direction.AUTO);
    }

    public StringValue(String value, String locale, String source, Direction dir) {
        this.value = Objects.requireNonNull(value, "value");
        this.locale = locale != null ? locale : "";
        this.source = source != null ? source : "";
        this.dir = dir != null ? dir : Direction.AUTO;
    }

    @Override
    public String type() {
        return "string";
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
    public String toString() {
        return value;
    }

    @Override
    public List<MessagePart> toParts() {
        return List.of(new StringPart(value, source, locale, dir));
    }

    @Override
    public String valueOf() {
        return value;
    }

    @Override
    public boolean selectable() {
        return true;
    }

    @Override
    public List<String> selectKeys(List<String> keys) {
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFC);
        for (String key : keys) {
            if (Normalizer.normalize(key, Normalizer.Form.NFC).equals(normalized)) {
                return List.of(key);
            }
        }
        return List.of();
    }
}
