package work.lcod.pmm.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Declared type of a record attribute, with the coercion applied to every assigned value.
 */
public final class AttributeType {
    private enum Shape { ANY, STRING, INTEGER, REAL, TAGS, ENUM, RECORD, LIST }

    private static final AttributeType ANY = new AttributeType(Shape.ANY, "any", TagValue.class, null, null, null);
    private static final AttributeType STRING = new AttributeType(Shape.STRING, "string", String.class, null, null, null);
    private static final AttributeType INTEGER = new AttributeType(Shape.INTEGER, "integer", Long.class, null, null, null);
    private static final AttributeType REAL = new AttributeType(Shape.REAL, "real", Double.class, null, null, null);
    private static final AttributeType TAGS = new AttributeType(Shape.TAGS, "tags", Tags.class, null, null, null);

    private final Shape shape;
    private final String label;
    private final Class<?> javaType;
    private final Function<Arguments, ? extends PmmRecord> recordFactory;
    private final Function<String, ?> parser;
    private final AttributeType element;

    private AttributeType(
        Shape shape,
        String label,
        Class<?> javaType,
        Function<Arguments, ? extends PmmRecord> recordFactory,
        Function<String, ?> parser,
        AttributeType element
    ) {
        this.shape = shape;
        this.label = label;
        this.javaType = javaType;
        this.recordFactory = recordFactory;
        this.parser = parser;
        this.element = element;
    }

    public static AttributeType any() {
        return ANY;
    }

    public static AttributeType string() {
        return STRING;
    }

    public static AttributeType integer() {
        return INTEGER;
    }

    public static AttributeType real() {
        return REAL;
    }

    public static AttributeType tags() {
        return TAGS;
    }

    public static <E extends Enum<E>> AttributeType enumeration(Class<E> type, Function<String, E> parser) {
        return new AttributeType(Shape.ENUM, type.getSimpleName(), type, null, Objects.requireNonNull(parser), null);
    }

    public static <R extends PmmRecord> AttributeType record(Class<R> type, Function<Arguments, R> factory) {
        return new AttributeType(Shape.RECORD, type.getSimpleName(), type, Objects.requireNonNull(factory), null, null);
    }

    public static AttributeType listOf(AttributeType element) {
        return new AttributeType(Shape.LIST, "[" + element.label + "]", List.class, null, null, element);
    }

    public String label() {
        return label;
    }

    /**
     * Coerces {@code value} to this type: nested records are built from plain maps, list elements
     * are coerced one by one, matching values pass through, anything else is converted directly.
     */
    Object coerce(Object value, String attribute, String owner) {
        if (shape == Shape.RECORD && value instanceof Map<?, ?> map) {
            return recordFactory.apply(Arguments.named(map));
        }
        if (shape == Shape.LIST && value instanceof List<?> list) {
            List<Object> coerced = new ArrayList<>(list.size());
            for (Object item : list) {
                coerced.add(item == null && element.shape != Shape.ANY ? null : element.coerce(item, attribute, owner));
            }
            return coerced;
        }
        if (shape == Shape.ANY) {
            return asTagValue(value, attribute, owner);
        }
        if (javaType.isInstance(value)) {
            return value;
        }
        try {
            return convert(value);
        } catch (PmmException | IllegalArgumentException | ArithmeticException ex) {
            throw new PmmException(
                PmmErrorCode.TYPE_MISMATCH,
                "Cannot convert " + describe(value) + " to " + label + " for attribute " + attribute + " of " + owner,
                ex
            );
        }
    }

    private Object convert(Object value) {
        Object converted = switch (shape) {
            case STRING -> value instanceof Boolean flag
                ? (flag ? "True" : "False")
                : value instanceof Number || value instanceof Character ? String.valueOf(value) : null;
            case INTEGER -> toLong(value);
            case REAL -> value instanceof Number number
                ? (Object) number.doubleValue()
                : value instanceof String text ? (Object) Double.parseDouble(text.trim()) : null;
            case TAGS -> value instanceof Map<?, ?> map ? Tags.from(map) : null;
            case ENUM -> value instanceof String text ? parser.apply(text) : null;
            default -> null;
        };
        if (converted == null) {
            throw new IllegalArgumentException("incompatible value");
        }
        return converted;
    }

    private static Long toLong(Object value) {
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.longValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            return Long.parseLong(text.trim());
        }
        return null;
    }

    private static TagValue asTagValue(Object value, String attribute, String owner) {
        try {
            return TagValue.of(value);
        } catch (PmmException ex) {
            throw new PmmException(
                PmmErrorCode.TYPE_MISMATCH,
                "Unsupported value " + describe(value) + " for attribute " + attribute + " of " + owner,
                ex
            );
        }
    }

    private static String describe(Object value) {
        return value.getClass().getSimpleName() + " '" + value + "'";
    }

    @Override
    public String toString() {
        return label;
    }
}
