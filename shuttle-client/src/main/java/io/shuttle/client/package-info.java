/**
 * The Shuttle client: {@link io.shuttle.client.Shuttle}, the {@link io.shuttle.client.Transport} SPI
 * with its network and scripted implementations, and the {@link io.shuttle.client.Middleware}
 * pipeline.
 */
package io.shuttle.client;
