/**
 * Subscription registry: the only writer of subscription records and statistics.
 *
 * @see io.hookline.registry.SubscriptionRegistry
 */
package io.hookline.registry;
