/**
 * Generic table model and its JSON file codec.
 *
 * <p>A {@link com.ryuqq.dealstore.adapter.file.table.Workbook} is an ordered set of named
 * {@link com.ryuqq.dealstore.adapter.file.table.Table}s, each a grid of text cells.
 * {@link com.ryuqq.dealstore.adapter.file.table.WorkbookCodec} reads and writes it with
 * Jackson. Nothing here depends on the deal model.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.table;
