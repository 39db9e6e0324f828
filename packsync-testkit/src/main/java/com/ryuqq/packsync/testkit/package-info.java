/**
 * Test support for packsync components.
 *
 * <ul>
 *   <li>{@code contract}: in-memory StateStore and the abstract StateStore contract test</li>
 *   <li>{@code registry}: stub registry HTTP server and JSON payload builders</li>
 *   <li>{@code generator}: recording PackGenerator</li>
 *   <li>{@code fixture}: ServerRecord fixtures</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.testkit;
