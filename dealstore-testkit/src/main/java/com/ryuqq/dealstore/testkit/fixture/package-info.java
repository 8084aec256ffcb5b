/**
 * Test fixtures: sample deals and a controllable clock.
 *
 * @since 1.0.0
 */
package com.ryuqq.dealstore.testkit.fixture;
