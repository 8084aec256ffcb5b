package com.ryuqq.dealstore.adapter.file.schema;

import com.ryuqq.dealstore.adapter.file.table.Workbook;

/**
 * One step of the schema migration chain, from a version to the next.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Additive: never drops tables, rows or columns it does not recognize</li>
 *   <li>Idempotent: applying the step twice leaves the workbook as applying it once</li>
 *   <li>Ends with the Version property equal to {@link #toVersion()}</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public interface SchemaMigration {

    String fromVersion();

    String toVersion();

    /**
     * Rewrites the workbook in place.
     *
     * @param workbook workbook at {@link #fromVersion()}
     */
    void apply(Workbook workbook);
}
