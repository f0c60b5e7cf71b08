package work.lcod.pmm.model;

import java.util.Optional;

/**
 * Optional summary statistics of a field.
 */
public final class Stats extends PmmRecord {
    public static final RecordSchema SCHEMA = RecordSchema.builder("Stats")
        .optional("nnulls", AttributeType.integer())
        .optional("nuniques", AttributeType.integer())
        .optional("min", AttributeType.any())
        .optional("max", AttributeType.any())
        .optional("mean", AttributeType.real())
        .build();

    public Stats(Arguments arguments) {
        super(SCHEMA, arguments);
    }

    public static Stats empty() {
        return new Stats(Arguments.of());
    }

    public Optional<Long> nulls() {
        return optional("nnulls");
    }

    public Optional<Long> uniques() {
        return optional("nuniques");
    }

    public Optional<TagValue> min() {
        return optional("min");
    }

    public Optional<TagValue> max() {
        return optional("max");
    }

    public Optional<Double> mean() {
        return optional("mean");
    }
}
