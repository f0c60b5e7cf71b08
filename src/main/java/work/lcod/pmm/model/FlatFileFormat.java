package work.lcod.pmm.model;

import java.util.Optional;

/**
 * Layout of a delimited flat file a dataset was derived from.
 */
public final class FlatFileFormat extends PmmRecord {
    public static final RecordSchema SCHEMA = RecordSchema.builder("FlatFileFormat")
        .defaulted("encoding", AttributeType.string(), "UTF-8")
        .defaulted("separator", AttributeType.string(), ",")
        .defaulted("quote", AttributeType.string(), "\"")
        .defaulted("escape", AttributeType.string(), "\\")
        .defaulted("nullmarker", AttributeType.string(), "")
        .defaulted("headerrowcount", AttributeType.integer(), 1L)
        .defaulted("dateformat", AttributeType.string(), null)
        .build();

    public FlatFileFormat(Arguments arguments) {
        super(SCHEMA, arguments);
    }

    public static FlatFileFormat defaults() {
        return new FlatFileFormat(Arguments.of());
    }

    public String encoding() {
        return (String) get("encoding");
    }

    public String separator() {
        return (String) get("separator");
    }

    public String quote() {
        return (String) get("quote");
    }

    public String escape() {
        return (String) get("escape");
    }

    public String nullMarker() {
        return (String) get("nullmarker");
    }

    public long headerRowCount() {
        return (Long) get("headerrowcount");
    }

    public Optional<String> dateFormat() {
        return optional("dateformat");
    }
}
