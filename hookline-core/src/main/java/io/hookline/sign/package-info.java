/**
 * HMAC-SHA256 signing of outbound deliveries and generation of secrets.
 */
package io.hookline.sign;
