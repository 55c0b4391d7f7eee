/**
 * Stock {@link io.shuttle.client.Middleware} implementations.
 */
package io.shuttle.client.middleware;
