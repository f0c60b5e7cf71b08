package work.lcod.pmm.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Date-tag format written in strftime directives ({@code %Y-%m-%d %H:%M:%S}), the notation stored in
 * the {@code datetagformat} attribute of existing sidecar files. Names are rendered in English, as in
 * the C locale, which also fixes the {@code %c}, {@code %x} and {@code %X} layouts.
 */
public final class StrftimePattern {
    public static final String DEFAULT_FORMAT = "%Y-%m-%d %H:%M:%S";

    private static final Map<String, StrftimePattern> CACHE = new ConcurrentHashMap<>();

    private final String pattern;
    private final DateTimeFormatter formatter;

    private StrftimePattern(String pattern, DateTimeFormatter formatter) {
        this.pattern = pattern;
        this.formatter = formatter;
    }

    public static StrftimePattern compile(String pattern) {
        return CACHE.computeIfAbsent(pattern, p -> new StrftimePattern(p, buildFormatter(p)));
    }

    public String pattern() {
        return pattern;
    }

    public String format(LocalDateTime value) {
        return formatter.format(value);
    }

    /**
     * Parses {@code text}; fields the pattern does not carry default to 1900-01-01 00:00:00.
     */
    public Optional<LocalDateTime> parse(String text) {
        try {
            return Optional.of(LocalDateTime.parse(text, formatter));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter buildFormatter(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        Set<ChronoField> seen = EnumSet.noneOf(ChronoField.class);
        append(builder, pattern, seen);
        if (!seen.contains(ChronoField.YEAR)) {
            builder.parseDefaulting(ChronoField.YEAR, 1900);
        }
        if (!seen.contains(ChronoField.DAY_OF_YEAR)) {
            if (!seen.contains(ChronoField.MONTH_OF_YEAR)) {
                builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
            }
            if (!seen.contains(ChronoField.DAY_OF_MONTH)) {
                builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
            }
        }
        if (!seen.contains(ChronoField.HOUR_OF_DAY) && !seen.contains(ChronoField.CLOCK_HOUR_OF_AMPM)) {
            builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
        }
        if (!seen.contains(ChronoField.MINUTE_OF_HOUR)) {
            builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
        }
        if (!seen.contains(ChronoField.SECOND_OF_MINUTE)) {
            builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
        }
        return builder.toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }

    private static void append(DateTimeFormatterBuilder builder, String pattern, Set<ChronoField> seen) {
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= pattern.length()) {
                throw new IllegalArgumentException("Dangling % in date tag format: " + pattern);
            }
            char directive = pattern.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            if (literal.length() > 0) {
                builder.appendLiteral(literal.toString());
                literal.setLength(0);
            }
            switch (directive) {
                case 'Y' -> field(builder, seen, ChronoField.YEAR, 4);
                case 'y' -> {
                    builder.appendValueReduced(ChronoField.YEAR, 2, 2, 1969);
                    seen.add(ChronoField.YEAR);
                }
                case 'm' -> field(builder, seen, ChronoField.MONTH_OF_YEAR, 2);
                case 'd' -> field(builder, seen, ChronoField.DAY_OF_MONTH, 2);
                case 'e' -> {
                    builder.padNext(2).appendValue(ChronoField.DAY_OF_MONTH);
                    seen.add(ChronoField.DAY_OF_MONTH);
                }
                case 'H' -> field(builder, seen, ChronoField.HOUR_OF_DAY, 2);
                case 'I' -> field(builder, seen, ChronoField.CLOCK_HOUR_OF_AMPM, 2);
                case 'M' -> field(builder, seen, ChronoField.MINUTE_OF_HOUR, 2);
                case 'S' -> field(builder, seen, ChronoField.SECOND_OF_MINUTE, 2);
                case 'f' -> field(builder, seen, ChronoField.MICRO_OF_SECOND, 6);
                case 'j' -> field(builder, seen, ChronoField.DAY_OF_YEAR, 3);
                case 'p' -> builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
                case 'b' -> text(builder, seen, ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                case 'B' -> text(builder, seen, ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                case 'a' -> builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                case 'A' -> builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                case 'T' -> append(builder, "%H:%M:%S", seen);
                case 'F' -> append(builder, "%Y-%m-%d", seen);
                case 'c' -> append(builder, "%a %b %e %H:%M:%S %Y", seen);
                case 'x' -> append(builder, "%m/%d/%y", seen);
                case 'X' -> append(builder, "%H:%M:%S", seen);
                default -> throw new IllegalArgumentException(
                    "Unsupported directive %" + directive + " in date tag format: " + pattern
                );
            }
        }
        if (literal.length() > 0) {
            builder.appendLiteral(literal.toString());
        }
    }

    private static void field(DateTimeFormatterBuilder builder, Set<ChronoField> seen, ChronoField field, int width) {
        builder.appendValue(field, width);
        seen.add(field);
    }

    private static void text(DateTimeFormatterBuilder builder, Set<ChronoField> seen, ChronoField field, TextStyle style) {
        builder.appendText(field, style);
        seen.add(field);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
