/**
 * Structural validation of durable files, run before load and before every commit.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.validation;
