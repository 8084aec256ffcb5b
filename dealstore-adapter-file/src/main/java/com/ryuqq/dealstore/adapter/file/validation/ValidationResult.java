package com.ryuqq.dealstore.adapter.file.validation;

import java.util.List;

/**
 * Outcome of a structural check of a durable file. Computed on demand, never persisted.
 *
 * @param valid true when the file can be loaded (possibly after migration)
 * @param errors reasons the file is not loadable
 * @param warnings problems that do not prevent loading
 * @param dealCount number of data rows in the Deals table
 * @param hasDealsTable whether a Deals table exists
 * @param hasLookupsTable whether a Lookups table exists
 * @param hasMetadataTable whether a Metadata table exists
 * @param schemaVersion detected version ("1.0" when not recorded)
 * @param requiresMigration true when the version is supported but older than current
 * @param supportedVersion false when the version is outside the supported set
 * @author DealStore Team
 * @since 1.0.0
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    int dealCount,
    boolean hasDealsTable,
    boolean hasLookupsTable,
    boolean hasMetadataTable,
    String schemaVersion,
    boolean requiresMigration,
    boolean supportedVersion
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Result for a file that could not be read at all.
     */
    public static ValidationResult unreadable(String error) {
        return new ValidationResult(false, List.of(error), List.of(), 0,
            false, false, false, null, false, false);
    }
}
