/**
 * Immutable HTTP message model shared by the Shuttle client and its transports.
 *
 * <p>This module has no transport of its own. It contains:
 * <ul>
 *   <li>{@link io.shuttle.core.Request} and {@link io.shuttle.core.Response} value types</li>
 *   <li>A case-insensitive, order-preserving header multimap</li>
 *   <li>Request body types and a bounded-memory response buffer</li>
 *   <li>The exception hierarchy</li>
 * </ul>
 */
package io.shuttle.core;
