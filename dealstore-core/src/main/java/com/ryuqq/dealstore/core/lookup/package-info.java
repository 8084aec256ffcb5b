/**
 * Static reference tables consulted by normalization.
 *
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.lookup;
