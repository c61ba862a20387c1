/**
 * Domain model: subscriptions, events, delivery outcomes and statistics.
 *
 * @see io.hookline.model.Subscription
 * @see io.hookline.model.EventEnvelope
 */
package io.hookline.model;
