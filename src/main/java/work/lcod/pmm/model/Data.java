package work.lcod.pmm.model;

/**
 * Provenance of a dataset: the file it was originally read from. Informational only.
 */
public final class Data extends PmmRecord {
    public static final RecordSchema SCHEMA = RecordSchema.builder("Data")
        .required("flatfile", AttributeType.record(FlatFile.class, FlatFile::new))
        .build();

    public Data(Arguments arguments) {
        super(SCHEMA, arguments);
    }

    public static Data of(FlatFile flatFile) {
        return new Data(Arguments.of(flatFile));
    }

    public FlatFile flatFile() {
        return (FlatFile) get("flatfile");
    }
}
