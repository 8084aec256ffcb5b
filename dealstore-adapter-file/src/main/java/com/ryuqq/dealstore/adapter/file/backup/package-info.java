/**
 * Rotating timestamped backups of the durable file.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.backup;
