package work.lcod.pmm.model;

/**
 * A named flat file together with its format.
 */
public final class FlatFile extends PmmRecord {
    public static final RecordSchema SCHEMA = RecordSchema.builder("FlatFile")
        .required("name", AttributeType.string())
        .required("format", AttributeType.record(FlatFileFormat.class, FlatFileFormat::new))
        .build();

    public FlatFile(Arguments arguments) {
        super(SCHEMA, arguments);
    }

    public static FlatFile of(String name, FlatFileFormat format) {
        return new FlatFile(Arguments.of(name, format));
    }

    public String name() {
        return (String) get("name");
    }

    public FlatFileFormat format() {
        return (FlatFileFormat) get("format");
    }
}
