/**
 * Asynchronous, signed, retried delivery of events to subscriptions.
 *
 * @see io.hookline.dispatch.DeliveryDispatcher
 */
package io.hookline.dispatch;
