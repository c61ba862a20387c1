/**
 * Batched age-based deletion of stored events.
 */
package io.hookline.jdbc.purge;
