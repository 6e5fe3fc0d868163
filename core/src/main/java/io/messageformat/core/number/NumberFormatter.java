package io.messageformat.core.number;

import io.messageformat.core.locale.LocaleTags;
import io.messageformat.core.part.NumberSubPart;
import io.messageformat.core.part.NumberSubPart.Kind;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats numbers for the {@code decimal}, {@code percent}, {@code currency} and {@code unit}
 * styles.
 *
 * <p>Formatting is a single structured pass: the value is rounded, rendered with the locale's
 * {@link DecimalFormat}, and emitted directly as typed sub-parts (sign, integer digits, decimal
 * separator, fraction digits, adornments). The rendered string is the concatenation of the parts,
 * so it never needs to be re-parsed.
 *
 * <p>Fraction digits resolve as: explicit option, then style default (the currency's minor
 * units), then a heuristic: no fraction digits for integral values, otherwise at most 3 (1 for
 * percentages). Significant-digit options take precedence over fraction digits.
 */
public final class NumberFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(NumberFormatter.class);

    private static final int DEFAULT_MAX_FRACTION_DIGITS = 3;
    private static final int PERCENT_MAX_FRACTION_DIGITS = 1;
    private static final int MAX_SIGNIFICANT_DIGITS = 21;

    private static final Map<String, String> CURRENCY_NAMES = Map.ofEntries(
            Map.entry("USD", "US dollars"),
            Map.entry("EUR", "euros"),
            Map.entry("GBP", "British pounds"),
            Map.entry("JPY", "Japanese yen"),
            Map.entry("CNY", "Chinese yuan"),
            Map.entry("CAD", "Canadian dollars"),
            Map.entry("AUD", "Australian dollars"),
            Map.entry("CHF", "Swiss francs"),
            Map.entry("SEK", "Swedish kronor"),
            Map.entry("NOK", "Norwegian kroner"),
            Map.entry("DKK", "Danish kroner"),
            Map.entry("PLN", "Polish zloty"),
            Map.entry("CZK", "Czech koruna"),
            Map.entry("HUF", "Hungarian forint"),
            Map.entry("RUB", "Russian rubles"),
            Map.entry("INR", "Indian rupees"),
            Map.entry("KRW", "South Korean won"),
            Map.entry("SGD", "Singapore dollars"),
            Map.entry("HKD", "Hong Kong dollars"),
            Map.entry("NZD", "New Zealand dollars"),
            Map.entry("MXN", "Mexican pesos"),
            Map.entry("BRL", "Brazilian reais"),
            Map.entry("ZAR", "South African rand"),
            Map.entry("TRY", "Turkish lira"),
            Map.entry("ILS", "Israeli shekels"),
            Map.entry("THB", "Thai baht"),
            Map.entry("MYR", "Malaysian ringgit"),
            Map.entry("PHP", "Philippine pesos"),
            Map.entry("IDR", "Indonesian rupiah"),
            Map.entry("VND", "Vietnamese dong"));

    private static final Map<String, UnitName> UNITS = Map.of(
            "meter", new UnitName("m", "meter", "meters"),
            "kilometer", new UnitName("km", "kilometer", "kilometers"),
            "gram", new UnitName("g", "gram", "grams"),
            "kilogram", new UnitName("kg", "kilogram", "kilograms"),
            "second", new UnitName("s", "second", "seconds"),
            "minute", new UnitName("min", "minute", "minutes"),
            "hour", new UnitName("h", "hour", "hours"));

    private NumberFormatter() {
        // utility class
    }

    /**
     * Formats {@code value} for {@code locale} (a BCP 47 tag; empty means {@code en-US}).
     *
     * @param value a supported numeric type, see {@link Numbers#isSupported(Object)}
     * @return the sub-parts of the rendered number
     */
    public static FormattedNumber format(Number value, String locale, NumberOptions options) {
        Locale loc = LocaleTags.toLocale(locale);
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(loc);

        boolean negative;
        boolean zero;
        BigDecimal magnitude = null;
        List<NumberSubPart> digits;
        if (Numbers.isFinite(value)) {
            BigDecimal number = Numbers.toBigDecimal(value);
            if (options.isPercent()) {
                number = number.movePointRight(2);
            }
            negative = Numbers.isNegative(value);
            zero = number.signum() == 0;
            magnitude = number.abs();
            digits = formatDigits(number, loc, symbols, options);
        } else {
            double d = value.doubleValue();
            negative = d < 0;
            zero = false;
            digits = List.of(new NumberSubPart(Kind.INTEGER, Double.isNaN(d) ? symbols.getNaN() : symbols.getInfinity()));
        }

        String sign = sign(negative, zero, options.signDisplay(), symbols);
        List<NumberSubPart> parts = new ArrayList<>();
        switch (options.style()) {
            case NumberOptions.CURRENCY -> {
                if (options.currency() != null) {
                    appendCurrency(parts, sign, negative && !zero, digits, loc, options);
                } else {
                    appendSigned(parts, sign, digits);
                }
            }
            case NumberOptions.PERCENT -> {
                appendSigned(parts, sign, digits);
                parts.add(new NumberSubPart(Kind.PERCENT_SIGN, String.valueOf(symbols.getPercent())));
            }
            case NumberOptions.UNIT -> {
                appendSigned(parts, sign, digits);
                if (options.unit() != null) {
                    parts.add(new NumberSubPart(Kind.LITERAL, " "));
                    parts.add(new NumberSubPart(Kind.UNIT, unitLabel(options.unit(), options.unitDisplay(), magnitude)));
                }
            }
            default -> appendSigned(parts, sign, digits);
        }
        return new FormattedNumber(parts);
    }

    /** Convenience overload reading a resolved option map. */
    public static FormattedNumber format(Number value, String locale, Map<String, Object> options) {
        return format(value, locale, NumberOptions.from(options));
    }

    // --- Digits ---

    private static List<NumberSubPart> formatDigits(
            BigDecimal number, Locale locale, DecimalFormatSymbols symbols, NumberOptions options) {
        int minFraction;
        int maxFraction;
        RoundingMode mode = roundingMode(options.roundingMode(), number.signum());

        if (options.minimumSignificantDigits() != null || options.maximumSignificantDigits() != null) {
            int minSig = options.minimumSignificantDigits() != null ? options.minimumSignificantDigits() : 1;
            int maxSig = options.maximumSignificantDigits() != null
                    ? options.maximumSignificantDigits()
                    : MAX_SIGNIFICANT_DIGITS;
            maxSig = Math.max(Math.max(maxSig, minSig), 1);
            number = number.round(new MathContext(maxSig, mode));
            int integerDigits = number.precision() - number.scale();
            maxFraction = Math.max(0, number.stripTrailingZeros().scale());
            minFraction = Math.max(0, minSig - integerDigits);
        } else {
            int[] bounds = fractionBounds(number, options);
            minFraction = bounds[0];
            maxFraction = bounds[1];
        }
        maxFraction = Math.max(maxFraction, minFraction);

        BigDecimal rounded = number.setScale(maxFraction, mode);
        if ("stripIfInteger".equals(options.trailingZeroDisplay()) && Numbers.isIntegral(rounded)) {
            minFraction = 0;
        }

        DecimalFormat df = decimalFormat(locale, symbols);
        df.setGroupingUsed(options.useGrouping());
        df.setMinimumFractionDigits(minFraction);
        df.setMaximumFractionDigits(maxFraction);
        if (options.minimumIntegerDigits() != null) {
            df.setMinimumIntegerDigits(options.minimumIntegerDigits());
        }
        String text = df.format(rounded.abs());

        List<NumberSubPart> parts = new ArrayList<>(3);
        String decimalSeparator = String.valueOf(symbols.getDecimalSeparator());
        int split = maxFraction > 0 ? text.lastIndexOf(decimalSeparator) : -1;
        if (split >= 0) {
            parts.add(new NumberSubPart(Kind.INTEGER, text.substring(0, split)));
            parts.add(new NumberSubPart(Kind.DECIMAL, decimalSeparator));
            if (split + 1 < text.length()) {
                parts.add(new NumberSubPart(Kind.FRACTION, text.substring(split + 1)));
            }
        } else {
            parts.add(new NumberSubPart(Kind.INTEGER, text));
        }
        return parts;
    }

    /** Returns {@code {min, max}} fraction digits for the non-significant-digit path. */
    static int[] fractionBounds(BigDecimal number, NumberOptions options) {
        Integer min = options.minimumFractionDigits();
        Integer max = options.maximumFractionDigits();

        if (NumberOptions.CURRENCY.equals(options.style()) && options.currency() != null) {
            int minor = currencyDigits(options.currency());
            int resolvedMin = min != null ? min : (max != null ? Math.min(minor, max) : minor);
            int resolvedMax = max != null ? max : Math.max(minor, resolvedMin);
            return new int[] {resolvedMin, resolvedMax};
        }

        int resolvedMin = min != null ? min : 0;
        int resolvedMax;
        if (max != null) {
            resolvedMax = max;
        } else if (resolvedMin > 0) {
            resolvedMax = resolvedMin;
        } else if (Numbers.isIntegral(number)) {
            resolvedMax = 0;
        } else {
            resolvedMax = options.isPercent() ? PERCENT_MAX_FRACTION_DIGITS : DEFAULT_MAX_FRACTION_DIGITS;
        }
        return new int[] {resolvedMin, Math.max(resolvedMin, resolvedMax)};
    }

    private static DecimalFormat decimalFormat(Locale locale, DecimalFormatSymbols symbols) {
        NumberFormat nf = NumberFormat.getNumberInstance(locale);
        if (nf instanceof DecimalFormat decimal) {
            return decimal;
        }
        return new DecimalFormat("#,##0.###", symbols);
    }

    /**
     * Maps an {@code Intl} rounding mode name to a {@link RoundingMode} for a value of the given
     * sign. The half-ceil and half-floor modes depend on the sign; unknown names use half-expand.
     */
    static RoundingMode roundingMode(String name, int signum) {
        return switch (name == null ? "" : name) {
            case "ceil" -> RoundingMode.CEILING;
            case "floor" -> RoundingMode.FLOOR;
            case "expand" -> RoundingMode.UP;
            case "trunc" -> RoundingMode.DOWN;
            case "halfCeil" -> signum >= 0 ? RoundingMode.HALF_UP : RoundingMode.HALF_DOWN;
            case "halfFloor" -> signum >= 0 ? RoundingMode.HALF_DOWN : RoundingMode.HALF_UP;
            case "halfTrunc" -> RoundingMode.HALF_DOWN;
            case "halfEven" -> RoundingMode.HALF_EVEN;
            default -> RoundingMode.HALF_UP;
        };
    }

    // --- Sign ---

    /**
     * Sign string for the given display mode, or {@code null} when no sign is shown.
     *
     * <p>{@code negative} and {@code zero} describe the value before rounding, so {@code 0.0001}
     * with {@code exceptZero} renders as {@code +0}.
     */
    static String sign(boolean negative, boolean zero, String signDisplay, DecimalFormatSymbols symbols) {
        String minus = String.valueOf(symbols.getMinusSign());
        return switch (signDisplay == null ? "auto" : signDisplay) {
            case "always" -> negative ? minus : (zero ? null : "+");
            case "exceptZero" -> zero ? null : (negative ? minus : "+");
            case "negative" -> negative && !zero ? minus : null;
            case "never" -> null;
            default -> negative ? minus : null;
        };
    }

    private static void appendSigned(List<NumberSubPart> parts, String sign, List<NumberSubPart> digits) {
        if (sign != null) {
            parts.add(new NumberSubPart(sign.equals("+") ? Kind.PLUS_SIGN : Kind.MINUS_SIGN, sign));
        }
        parts.addAll(digits);
    }

    // --- Currency ---

    private static void appendCurrency(
            List<NumberSubPart> parts,
            String sign,
            boolean negative,
            List<NumberSubPart> digits,
            Locale locale,
            NumberOptions options) {
        String code = options.currency().toUpperCase(Locale.ROOT);
        Currency currency = currency(code);
        boolean accounting = "accounting".equals(options.currencySign()) && negative;
        String display = options.currencyDisplay();

        if (accounting) {
            parts.add(new NumberSubPart(Kind.LITERAL, "("));
            sign = null;
        }
        if ("name".equals(display)) {
            appendSigned(parts, sign, digits);
            parts.add(new NumberSubPart(Kind.LITERAL, " "));
            parts.add(new NumberSubPart(Kind.CURRENCY, currencyName(code, currency, locale)));
        } else if ("code".equals(display)) {
            if (sign != null) {
                appendSigned(parts, sign, List.of());
            }
            parts.add(new NumberSubPart(Kind.CURRENCY, code));
            parts.add(new NumberSubPart(Kind.LITERAL, " "));
            parts.addAll(digits);
        } else {
            String symbol = currency != null ? currency.getSymbol(locale) : code;
            CurrencyLayout layout = currencyLayout(locale);
            if (layout.prefix()) {
                appendSigned(parts, sign, List.of());
                parts.add(new NumberSubPart(Kind.CURRENCY, symbol));
                if (!layout.spacing().isEmpty()) {
                    parts.add(new NumberSubPart(Kind.LITERAL, layout.spacing()));
                }
                parts.addAll(digits);
            } else {
                appendSigned(parts, sign, digits);
                if (!layout.spacing().isEmpty()) {
                    parts.add(new NumberSubPart(Kind.LITERAL, layout.spacing()));
                }
                parts.add(new NumberSubPart(Kind.CURRENCY, symbol));
            }
        }
        if (accounting) {
            parts.add(new NumberSubPart(Kind.LITERAL, ")"));
        }
    }

    private static Currency currency(String code) {
        try {
            return Currency.getInstance(code);
        } catch (IllegalArgumentException e) {
            LOG.debug("Unknown ISO 4217 currency code '{}', rendering the code itself", code);
            return null;
        }
    }

    private static int currencyDigits(String code) {
        Currency currency = currency(code.toUpperCase(Locale.ROOT));
        if (currency == null) {
            return 2;
        }
        return Math.max(0, currency.getDefaultFractionDigits());
    }

    private static String currencyName(String code, Currency currency, Locale locale) {
        if ("en".equals(locale.getLanguage()) && CURRENCY_NAMES.containsKey(code)) {
            return CURRENCY_NAMES.get(code);
        }
        return currency != null ? currency.getDisplayName(locale) : code;
    }

    /** Reads symbol placement from the locale's currency pattern ({@code ¤#,##0.00} → prefix). */
    private static CurrencyLayout currencyLayout(Locale locale) {
        NumberFormat nf = NumberFormat.getCurrencyInstance(locale);
        if (nf instanceof DecimalFormat decimal) {
            String pattern = decimal.toPattern();
            int semicolon = pattern.indexOf(';');
            if (semicolon >= 0) {
                pattern = pattern.substring(0, semicolon);
            }
            int symbol = pattern.indexOf('¤');
            int digit = firstDigit(pattern);
            if (symbol >= 0 && digit >= 0) {
                boolean prefix = symbol < digit;
                int adjacent = prefix ? symbol + 1 : symbol - 1;
                String spacing = adjacent >= 0
                                && adjacent < pattern.length()
                                && Character.isSpaceChar(pattern.charAt(adjacent))
                        ? String.valueOf(pattern.charAt(adjacent))
                        : "";
                return new CurrencyLayout(prefix, spacing);
            }
        }
        return new CurrencyLayout(true, "");
    }

    private static int firstDigit(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '#' || c == '0') {
                return i;
            }
        }
        return -1;
    }

    private record CurrencyLayout(boolean prefix, String spacing) {}

    // --- Units ---

    private static String unitLabel(String unit, String unitDisplay, BigDecimal magnitude) {
        UnitName name = UNITS.get(unit);
        if (name == null) {
            return unit;
        }
        if ("long".equals(unitDisplay)) {
            return magnitude != null && magnitude.compareTo(BigDecimal.ONE) == 0 ? name.singular() : name.plural();
        }
        return name.symbol();
    }

    private record UnitName(String symbol, String singular, String plural) {}
}
