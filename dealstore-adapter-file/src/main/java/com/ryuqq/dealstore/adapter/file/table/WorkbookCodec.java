package com.ryuqq.dealstore.adapter.file.table;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Jackson codec for the workbook file.
 *
 * <p><strong>File Layout:</strong></p>
 * <pre>
 * {
 *   "format": "dealstore-workbook",
 *   "tables": [
 *     { "name": "Deals",    "rows": [["DealId", "AccountName", ...], ["D-...", "Acme", ...]] },
 *     { "name": "Lookups",  "rows": [...] },
 *     { "name": "Metadata", "rows": [["Property", "Value"], ["Version", "1.2"], ...] }
 *   ]
 * }
 * </pre>
 *
 * <p>Cells are always strings. Unknown top-level properties are ignored on read, so files
 * written by a newer build stay readable as long as the tables themselves are.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class WorkbookCodec {

    public static final String FORMAT = "dealstore-workbook";

    private final ObjectMapper mapper;

    public WorkbookCodec() {
        this(new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL));
    }

    public WorkbookCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Reads a workbook file.
     *
     * @param path file to read
     * @return decoded workbook
     * @throws WorkbookFormatException if the file is not a well-formed workbook
     * @throws IOException if the file cannot be read
     */
    public Workbook read(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }

    public Workbook decode(byte[] bytes) {
        Document document;
        try {
            document = mapper.readValue(bytes, Document.class);
        } catch (JacksonException e) {
            throw new WorkbookFormatException("Malformed workbook JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new WorkbookFormatException("Unreadable workbook", e);
        }
        if (document == null || !FORMAT.equals(document.format())) {
            throw new WorkbookFormatException("Not a " + FORMAT + " file");
        }
        Workbook workbook = new Workbook();
        if (document.tables() != null) {
            for (TableDocument t : document.tables()) {
                if (t == null || t.name() == null || t.name().isBlank()) {
                    throw new WorkbookFormatException("Table without a name");
                }
                Table table = new Table(t.name());
                if (t.rows() != null) {
                    for (List<String> row : t.rows()) {
                        table.addRow(row == null ? List.of() : row);
                    }
                }
                workbook.putTable(table);
            }
        }
        return workbook;
    }

    /**
     * Writes a workbook to the given path, replacing any existing file.
     *
     * <p>The content is forced to the storage device before this method returns, so a rename of
     * {@code path} that follows never exposes a file whose data was not yet written.</p>
     *
     * @param workbook workbook to write
     * @param path destination
     * @throws IOException if the file cannot be written
     */
    public void write(Workbook workbook, Path path) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(encode(workbook));
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    public byte[] encode(Workbook workbook) {
        List<TableDocument> tables = new ArrayList<>();
        for (Table table : workbook.tables()) {
            tables.add(new TableDocument(table.name(), table.rows()));
        }
        try {
            return mapper.writeValueAsBytes(new Document(FORMAT, tables));
        } catch (JacksonException e) {
            throw new WorkbookFormatException("Failed to serialize workbook", e);
        }
    }

    public record Document(String format, List<TableDocument> tables) {
    }

    public record TableDocument(String name, List<List<String>> rows) {
    }
}
