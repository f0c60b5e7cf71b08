package work.lcod.pmm.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pmm.config.PmmSettings;
import work.lcod.pmm.model.Arguments;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.model.Stats;
import work.lcod.pmm.model.Tag;
import work.lcod.pmm.model.TagValue;
import work.lcod.pmm.model.Tags;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;
import work.lcod.pmm.table.Column;
import work.lcod.pmm.table.StorageType;
import work.lcod.pmm.table.Table;
import work.lcod.pmm.table.TableStore;
import work.lcod.pmm.table.TableStoreRegistry;

class DatasetIOTest {
    private static final LocalDateTime CREATED = LocalDateTime.of(2017, 1, 23, 14, 5);

    private static Dataset sample() {
        var dataset = new Dataset(new Table(List.of(
            Column.of("id", StorageType.INT64, 1L, 2L, 3L),
            Column.of("score", StorageType.FLOAT64, 0.5, Double.NaN, 2.5),
            Column.of("label", StorageType.OBJECT, "a", "b", "c"),
            Column.allNull("notes", StorageType.OBJECT, 3)
        )), "people");
        dataset.tagField("id", Tag.UNIQUE);
        dataset.tagDataset("created", CREATED);
        dataset.metadata().field("notes").setDescription("free text, never filled in");
        return dataset;
    }

    @Test
    void writesAndReadsBackTheDataset() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var tablePath = dir.resolve("people.csv");
        var io = new DatasetIO();
        var dataset = sample();

        io.write(dataset, tablePath);

        assertTrue(Files.exists(dir.resolve("people.pmm")));
        var header = Files.readAllLines(tablePath, StandardCharsets.UTF_8).get(0);
        assertEquals("id,score,label,notes_∅s", header);

        var read = io.read(tablePath);

        assertEquals(List.of("id", "score", "label", "notes"), read.table().columnNames());
        assertEquals(StorageType.OBJECT, read.table().column("notes").orElseThrow().storageType());
        assertEquals(0, read.table().column("notes").orElseThrow().nonNullCount());
        assertEquals(new TagValue.Date(CREATED), read.metadata().tags().get("created"));
        assertEquals(dataset.metadata(), read.metadata());
    }

    @Test
    void resavingUnchangedDatasetGivesIdenticalSidecar() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var io = new DatasetIO();
        io.write(sample(), dir.resolve("people.csv"));
        var first = Files.readString(dir.resolve("people.pmm"), StandardCharsets.UTF_8);

        var copyDir = Files.createDirectory(dir.resolve("copy"));
        io.write(io.read(dir.resolve("people.csv")), copyDir.resolve("people.csv"));

        assertEquals(first, Files.readString(copyDir.resolve("people.pmm"), StandardCharsets.UTF_8));
    }

    @Test
    void declaredTypesSurviveTheTableFormat() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var io = new DatasetIO();
        var dataset = sample();
        dataset.declareField("score", "integer");
        io.write(dataset, dir.resolve("people.csv"));

        var read = io.read(dir.resolve("people.csv"));

        assertEquals(StorageType.FLOAT64, read.table().column("score").orElseThrow().storageType());
        assertEquals(FieldType.INTEGER, read.metadata().field("score").fieldType());
    }

    @Test
    void missingSidecarIsInferred() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var tablePath = dir.resolve("survey.csv");
        Files.writeString(tablePath, "a,b,c\n1,x,true\n2,y,false\n", StandardCharsets.UTF_8);

        var read = new DatasetIO().read(tablePath);

        assertEquals("survey", read.metadata().name());
        assertEquals(2L, read.metadata().recordCount());
        assertEquals(FieldType.INTEGER, read.metadata().field("a").fieldType());
        assertEquals(FieldType.STRING, read.metadata().field("b").fieldType());
        assertEquals(FieldType.BOOLEAN, read.metadata().field("c").fieldType());
        assertFalse(Files.exists(dir.resolve("survey.pmm")));
    }

    @Test
    void staleSidecarIsReconciledOnRead() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var io = new DatasetIO();
        io.write(sample(), dir.resolve("people.csv"));
        Files.writeString(dir.resolve("people.csv"), "label,id,extra\na,1,9\n", StandardCharsets.UTF_8);

        var read = io.read(dir.resolve("people.csv"));

        assertEquals(List.of("label", "id", "extra"), read.metadata().fieldNames());
        assertEquals(1L, read.metadata().recordCount());
        assertTrue(read.metadata().field("id").tags().contains(Tag.UNIQUE));
    }

    @Test
    void readsTableWhereTwoSentinelsShareAName() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var tablePath = dir.resolve("clash.csv");
        Files.writeString(tablePath, "a_∅s,a_∅b\n", StandardCharsets.UTF_8);

        var read = new DatasetIO().read(tablePath);

        assertEquals(List.of("a", "a_∅b"), read.table().columnNames());
        assertEquals(List.of("a", "a_∅b"), read.metadata().fieldNames());
    }

    @Test
    void unknownTableFormatIsUnavailable() {
        var io = new DatasetIO();
        var error = assertThrows(PmmException.class, () -> io.read(Path.of("people.feather")));
        assertEquals(PmmErrorCode.TABLE_UNAVAILABLE, error.code());
        var writeError = assertThrows(PmmException.class, () -> io.write(sample(), Path.of("people.feather")));
        assertEquals(PmmErrorCode.TABLE_UNAVAILABLE, writeError.code());
    }

    @Test
    void failedTableWriteRemovesBothFiles() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var tablePath = dir.resolve("people.csv");
        var sidecar = dir.resolve("people.pmm");
        Files.writeString(sidecar, "{}", StandardCharsets.UTF_8);
        TableStore failing = new TableStore() {
            @Override
            public Table read(Path path) {
                throw new UnsupportedOperationException();
            }

            @Override
            public void write(Table table, Path path) throws IOException {
                Files.writeString(path, "id\n1", StandardCharsets.UTF_8);
                throw new IOException("disk full");
            }
        };
        var settings = PmmSettings.defaults();
        var io = new DatasetIO(settings, new TableStoreRegistry().register(".csv", failing));

        var error = assertThrows(IOException.class, () -> io.write(sample(), tablePath));

        assertEquals("disk full", error.getMessage());
        assertFalse(Files.exists(tablePath));
        assertFalse(Files.exists(sidecar));
    }

    @Test
    void failedSidecarWriteRemovesTheTable() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var tablePath = dir.resolve("people.csv");
        Files.createDirectory(dir.resolve("people.pmm"));

        assertThrows(IOException.class, () -> new DatasetIO().write(sample(), tablePath));

        assertFalse(Files.exists(tablePath));
        assertFalse(Files.exists(dir.resolve("people.pmm")));
    }

    @Test
    void invalidMetadataIsRejectedBeforeWriting() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var table = new Table(List.of(Column.of("id", StorageType.INT64, 1L)));
        var field = new Field(Arguments.of("id", "int", "", Tags.empty(), Stats.empty()));
        var dataset = new Dataset(table, Metadata.of("bad", 1, List.of(field)));

        var error = assertThrows(PmmException.class, () -> new DatasetIO().write(dataset, dir.resolve("bad.csv")));

        assertEquals(PmmErrorCode.UNKNOWN_CANONICAL_TYPE, error.code());
        assertFalse(Files.exists(dir.resolve("bad.csv")));
    }

    @Test
    void unwritableDateTagFormatLeavesNothingOnDisk() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var dataset = sample();
        dataset.metadata().setDateTagFormat("week %U");

        var error = assertThrows(PmmException.class, () -> new DatasetIO().write(dataset, dir.resolve("people.csv")));

        assertEquals(PmmErrorCode.UNSUPPORTED_DATE_TAG_FORMAT, error.code());
        assertFalse(Files.exists(dir.resolve("people.csv")));
        assertFalse(Files.exists(dir.resolve("people.pmm")));
    }

    @Test
    void customNullMarker() throws IOException {
        var dir = Files.createTempDirectory("pmm-io");
        var io = new DatasetIO(PmmSettings.builder().nullMarker("NULL").build());
        io.write(sample(), dir.resolve("people.csv"));

        var header = Files.readAllLines(dir.resolve("people.csv"), StandardCharsets.UTF_8).get(0);
        assertEquals("id,score,label,notes_NULLs", header);
        assertEquals(List.of("id", "score", "label", "notes"), io.read(dir.resolve("people.csv")).table().columnNames());
    }
}
