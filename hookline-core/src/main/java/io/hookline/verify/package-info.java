/**
 * Endpoint-ownership handshakes run before a subscription is activated.
 *
 * @see io.hookline.verify.HandshakeCoordinator
 */
package io.hookline.verify;
