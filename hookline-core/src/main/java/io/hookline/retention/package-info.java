/**
 * Event retention and cleanup of subscriptions stuck in verification.
 */
package io.hookline.retention;
