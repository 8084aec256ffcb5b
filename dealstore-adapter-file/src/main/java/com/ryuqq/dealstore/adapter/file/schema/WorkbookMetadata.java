package com.ryuqq.dealstore.adapter.file.schema;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes the {@code Metadata} table (Property / Value rows).
 *
 * <p><strong>Written properties:</strong> Version, LastModified (UTC instant from the
 * injected clock), DealCount, GeneratedBy.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class WorkbookMetadata {

    public static final String VERSION = "Version";
    public static final String LAST_MODIFIED = "LastModified";
    public static final String DEAL_COUNT = "DealCount";
    public static final String GENERATED_BY = "GeneratedBy";
    public static final String GENERATOR = "DealStore Sales Pipeline Manager";

    private WorkbookMetadata() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Value of a property, matched case-insensitively.
     *
     * @return trimmed value, or empty if the table or the row is missing
     */
    public static Optional<String> property(Workbook workbook, String property) {
        return workbook.table(Workbook.METADATA).flatMap(t -> property(t, property));
    }

    static Optional<String> property(Table table, String property) {
        int row = findRow(table, property);
        return row < 0 ? Optional.empty() : Optional.of(table.cell(row, 1).trim());
    }

    /**
     * Sets a property, appending a row if it does not exist yet.
     */
    public static void setProperty(Table table, String property, String value) {
        int row = findRow(table, property);
        if (row < 0) {
            table.addRow(property, value);
        } else {
            table.setCell(row, 1, value);
        }
    }

    /**
     * Returns the Metadata table, creating it with its header row if absent.
     */
    public static Table ensureTable(Workbook workbook) {
        Optional<Table> existing = workbook.table(Workbook.METADATA);
        if (existing.isPresent()) {
            return existing.get();
        }
        Table table = workbook.addTable(Workbook.METADATA);
        table.addRow("Property", "Value");
        return table;
    }

    /**
     * Builds a fresh Metadata table for a commit.
     */
    public static Table create(String version, Instant lastModified, int dealCount) {
        Table table = new Table(Workbook.METADATA);
        table.addRow("Property", "Value");
        table.addRow(VERSION, version);
        table.addRow(LAST_MODIFIED, lastModified.toString());
        table.addRow(DEAL_COUNT, String.valueOf(dealCount));
        table.addRow(GENERATED_BY, GENERATOR);
        return table;
    }

    private static int findRow(Table table, String property) {
        for (int r = 1; r < table.rowCount(); r++) {
            if (table.cell(r, 0).trim().equalsIgnoreCase(property)) {
                return r;
            }
        }
        return -1;
    }
}
