package io.messageformat.core.number;

import io.messageformat.core.part.NumberSubPart;
import java.util.List;

/** A number rendered as an ordered list of typed sub-parts. */
public record FormattedNumber(List<NumberSubPart> parts) {

    public FormattedNumber {
        parts = List.copyOf(parts);
    }

    /** The rendered string: all sub-part values concatenated. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (NumberSubPart part : parts) {
            sb.append(part.value());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text();
    }
}
