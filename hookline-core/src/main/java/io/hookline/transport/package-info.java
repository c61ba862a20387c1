/**
 * Outbound HTTP transport for deliveries and handshakes.
 */
package io.hookline.transport;
