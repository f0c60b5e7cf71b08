package work.lcod.pmm.table;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import work.lcod.pmm.model.FlatFileFormat;

/**
 * Table store for delimited text files laid out by a {@link FlatFileFormat}.
 *
 * <p>CSV carries no column types, so they are inferred on read: booleans, 64-bit integers, doubles and
 * ISO date-times, everything else being an object column. A column without any value reads back as an
 * all-NaN float column, and an integer column with gaps as a float column.
 */
public final class CsvTableStore implements TableStore {
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final CSVFormat format;
    private final Charset charset;

    public CsvTableStore(FlatFileFormat flatFileFormat) {
        this.format = CSVFormat.DEFAULT.builder()
            .setDelimiter(flatFileFormat.separator())
            .setQuote(firstChar(flatFileFormat.quote()))
            .setEscape(firstChar(flatFileFormat.escape()))
            .setNullString(flatFileFormat.nullMarker())
            .setRecordSeparator("\n")
            .build();
        this.charset = Charset.forName(flatFileFormat.encoding());
    }

    @Override
    public Table read(Path path) throws IOException {
        List<String> headers;
        List<List<String>> cells = new ArrayList<>();
        int rows = 0;
        CSVFormat readFormat = format.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(path, charset); CSVParser parser = readFormat.parse(reader)) {
            headers = parser.getHeaderNames();
            for (int i = 0; i < headers.size(); i++) {
                cells.add(new ArrayList<>());
            }
            for (CSVRecord record : parser) {
                for (int i = 0; i < headers.size(); i++) {
                    cells.get(i).add(i < record.size() ? record.get(i) : null);
                }
                rows++;
            }
        }
        List<Column> columns = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            columns.add(inferColumn(headers.get(i), cells.get(i)));
        }
        return new Table(columns, rows);
    }

    @Override
    public void write(Table table, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, charset); CSVPrinter printer = new CSVPrinter(writer, format)) {
            printer.printRecord(table.columnNames());
            List<Object> record = new ArrayList<>(table.columns().size());
            for (int row = 0; row < table.rowCount(); row++) {
                record.clear();
                for (Column column : table.columns()) {
                    record.add(cell(column.values().get(row)));
                }
                printer.printRecord(record);
            }
        }
    }

    private static Object cell(Object value) {
        if (Column.isNullValue(value)) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return DATE_TIME.format(dateTime);
        }
        return value.toString();
    }

    private static Column inferColumn(String name, List<String> raw) {
        int nulls = 0;
        boolean allBool = true;
        boolean allLong = true;
        boolean allDouble = true;
        boolean allDateTime = true;
        for (String value : raw) {
            if (value == null) {
                nulls++;
                continue;
            }
            allBool &= isBoolean(value);
            allLong &= parses(value, Long::parseLong);
            allDouble &= parses(value, Double::parseDouble);
            allDateTime &= parses(value, text -> LocalDateTime.parse(text, DATE_TIME));
        }
        if (nulls == raw.size()) {
            return Column.allNaN(name, raw.size());
        }
        List<Object> values = new ArrayList<>(raw.size());
        if (allBool) {
            for (String value : raw) {
                values.add(value == null ? null : Boolean.parseBoolean(value));
            }
            return new Column(name, nulls > 0 ? StorageType.OBJECT : StorageType.BOOL, values);
        }
        if (allLong && nulls == 0) {
            for (String value : raw) {
                values.add(Long.parseLong(value));
            }
            return new Column(name, StorageType.INT64, values);
        }
        if (allDouble) {
            for (String value : raw) {
                values.add(value == null ? Double.NaN : Double.parseDouble(value));
            }
            return new Column(name, StorageType.FLOAT64, values);
        }
        if (allDateTime) {
            for (String value : raw) {
                values.add(value == null ? null : LocalDateTime.parse(value, DATE_TIME));
            }
            return new Column(name, StorageType.DATETIME, values);
        }
        values.addAll(raw);
        return new Column(name, StorageType.OBJECT, values);
    }

    private static boolean isBoolean(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return "true".equals(lower) || "false".equals(lower);
    }

    private static boolean parses(String value, Parser parser) {
        try {
            parser.parse(value);
            return true;
        } catch (NumberFormatException | DateTimeParseException ex) {
            return false;
        }
    }

    private static Character firstChar(String value) {
        return value == null || value.isEmpty() ? null : value.charAt(0);
    }

    @FunctionalInterface
    private interface Parser {
        Object parse(String value);
    }
}
