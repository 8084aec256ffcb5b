/**
 * Cross-process serialization of commits through a lock marker file.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.file.lock;
