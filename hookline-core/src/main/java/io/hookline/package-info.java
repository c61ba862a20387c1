/**
 * Outgoing webhook delivery: subscriptions, signed fan-out delivery with retries, and
 * endpoint verification handshakes.
 *
 * <p>Start with {@link io.hookline.Hookline#builder()}.
 */
package io.hookline;
