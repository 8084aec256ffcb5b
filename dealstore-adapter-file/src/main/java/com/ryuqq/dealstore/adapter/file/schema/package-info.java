/**
 * On-disk schema versions and the migration chain between them.
 *
 * <p>The schema version lives in the {@code Metadata} table under {@code Version}. A file
 * without a Metadata table, or with a blank Version, is treated as 1.0.</p>
 *
 * <p><strong>버전 이력:</strong></p>
 * <ul>
 *   <li>1.0: Deals + Lookups only, no Metadata</li>
 *   <li>1.1: Metadata table with Version</li>
 *   <li>1.2: promoter attribution columns on Deals</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.schema;
