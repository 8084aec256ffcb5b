/**
 * Durable file store: a single JSON workbook per pipeline, committed atomically.
 *
 * <p><strong>On-disk layout:</strong></p>
 * <pre>
 * pipeline.json                          durable file
 * pipeline.json.lock                     lock marker (only during a commit)
 * ~$pipeline.json.1a2b3c4d.tmp           temp file (only during a commit)
 * pipeline_20250315_143000.json.bak      backups, newest maxBackups kept
 * </pre>
 *
 * <p><strong>Sub-packages:</strong></p>
 * <ul>
 *   <li>{@code table}: generic table model and Jackson codec</li>
 *   <li>{@code mapping}: Deals and Lookups tables to domain types</li>
 *   <li>{@code validation}: structural checks before load and commit</li>
 *   <li>{@code schema}: version detection and migration chain</li>
 *   <li>{@code lock}: cross-process lock marker with backoff</li>
 *   <li>{@code backup}: rotating backups</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file;
