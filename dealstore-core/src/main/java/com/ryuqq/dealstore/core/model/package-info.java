/**
 * Domain model of the record store.
 *
 * <p>This package contains the record entity and the types used to select records.</p>
 *
 * <p><strong>Core Types:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.dealstore.core.model.Deal}: the persisted record, keyed by a case-insensitive id</li>
 *   <li>{@link com.ryuqq.dealstore.core.model.DealStage}: pipeline stage with default probability</li>
 *   <li>{@link com.ryuqq.dealstore.core.model.DealFilter}: conjunction of optional query predicates</li>
 * </ul>
 *
 * <p><strong>Derived Fields:</strong></p>
 * <p>Postcode area, region and map link are filled by the normalization engine
 * ({@code core.normalize}). The weighted amount is computed on read and never stored.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.model;
