package gasmon.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Writes results as rows of a CSV file. The file is truncated when the writer is created, the
 * header is written with the first row, and every row is flushed as soon as it is written.
 *
 * @param <T> the result type
 * @param <R> the row type; its Jackson property order defines the columns
 */
public class CsvResultWriter<T, R> implements ResultWriter<T>, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(CsvResultWriter.class);

    private final Path file;
    private final Function<T, R> toRow;
    private final SequenceWriter sequenceWriter;

    /**
     * Opens the given file for writing.
     *
     * @param file     the destination file
     * @param rowType  the row class used to derive the header
     * @param toRow    converts a result into a row
     * @throws IOException if the file cannot be opened
     */
    public CsvResultWriter(Path file, Class<R> rowType, Function<T, R> toRow) throws IOException {
        this.file = Objects.requireNonNull(file, "Output file cannot be null.");
        this.toRow = Objects.requireNonNull(toRow, "Row mapper cannot be null.");

        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = mapper.schemaFor(rowType).withHeader();
        Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        this.sequenceWriter = mapper.writer(schema).writeValues(out);
        logger.info("Writing {} rows to {}", rowType.getSimpleName(), file.toAbsolutePath());
    }

    @Override
    public synchronized void write(T result) throws IOException {
        sequenceWriter.write(toRow.apply(result));
        sequenceWriter.flush();
        logger.debug("Wrote {} to {}", result, file);
    }

    @Override
    public synchronized void close() throws IOException {
        sequenceWriter.close();
    }
}
