/**
 * Contract test suite for {@code DealRepository} adapters.
 *
 * <p>Lives in {@code src/main} so adapter modules can extend it from their own tests.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.testkit.contract;
