/**
 * REST controllers for subscriptions, events and service info.
 */
package io.hookline.server.web;
