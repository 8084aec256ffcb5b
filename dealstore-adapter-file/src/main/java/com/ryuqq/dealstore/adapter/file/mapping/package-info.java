/**
 * Domain ↔ table mapping for the workbook file.
 *
 * <p>The {@code table} package knows only named grids of strings; this package gives the
 * {@code Deals} and {@code Lookups} tables their meaning.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.mapping;
