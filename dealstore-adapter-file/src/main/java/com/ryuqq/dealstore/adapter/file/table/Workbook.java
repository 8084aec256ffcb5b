package com.ryuqq.dealstore.adapter.file.table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of named {@link Table}s. Table names are unique ignoring case.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class Workbook {

    public static final String DEALS = "Deals";
    public static final String LOOKUPS = "Lookups";
    public static final String METADATA = "Metadata";

    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Optional<Table> table(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(key(name)));
    }

    public boolean hasTable(String name) {
        return table(name).isPresent();
    }

    /**
     * Adds an empty table, or returns the existing one with that name.
     */
    public Table addTable(String name) {
        return tables.computeIfAbsent(key(name), k -> new Table(name));
    }

    /**
     * Adds the table, replacing any table with the same name.
     */
    public void putTable(Table table) {
        tables.put(key(table.name()), table);
    }

    public List<Table> tables() {
        return List.copyOf(tables.values());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
