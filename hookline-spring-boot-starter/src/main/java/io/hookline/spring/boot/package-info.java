/**
 * Spring Boot auto-configuration for hookline.
 *
 * <p>Configure via {@code hookline.*} properties. See {@link io.hookline.spring.boot.HooklineProperties}.
 */
package io.hookline.spring.boot;
