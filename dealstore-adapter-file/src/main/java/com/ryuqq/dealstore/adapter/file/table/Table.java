package com.ryuqq.dealstore.adapter.file.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named grid of text cells, the unit the workbook file is made of.
 *
 * <p>Row 0 is the header row by convention; the table itself does not enforce it. Rows may
 * have different lengths; reading a cell past the end of a row yields an empty string.
 * The model knows nothing about deals.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class Table {

    private final String name;
    private final List<List<String>> rows = new ArrayList<>();

    public Table(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Appends a row. Null cells are stored as empty strings.
     *
     * @param cells cell values
     * @return this table
     */
    public Table addRow(List<String> cells) {
        if (cells == null) {
            throw new IllegalArgumentException("cells cannot be null");
        }
        List<String> row = new ArrayList<>(cells.size());
        for (String cell : cells) {
            row.add(cell == null ? "" : cell);
        }
        rows.add(row);
        return this;
    }

    public Table addRow(String... cells) {
        return addRow(Arrays.asList(cells));
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> row(int index) {
        return Collections.unmodifiableList(rows.get(index));
    }

    public List<List<String>> rows() {
        List<List<String>> view = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            view.add(Collections.unmodifiableList(row));
        }
        return Collections.unmodifiableList(view);
    }

    /**
     * @return the first row, or an empty list for an empty table
     */
    public List<String> header() {
        return rows.isEmpty() ? List.of() : row(0);
    }

    public String cell(int row, int column) {
        if (row < 0 || row >= rows.size() || column < 0) {
            return "";
        }
        List<String> cells = rows.get(row);
        return column < cells.size() ? cells.get(column) : "";
    }

    /**
     * Writes a cell, padding the row with empty cells when it is too short.
     */
    public void setCell(int row, int column, String value) {
        if (row < 0 || row >= rows.size()) {
            throw new IndexOutOfBoundsException("row " + row + " of " + rows.size());
        }
        List<String> cells = rows.get(row);
        while (cells.size() <= column) {
            cells.add("");
        }
        cells.set(column, value == null ? "" : value);
    }

    public void removeRow(int index) {
        rows.remove(index);
    }

    @Override
    public String toString() {
        return "Table{name='" + name + "', rows=" + rows.size() + '}';
    }
}
