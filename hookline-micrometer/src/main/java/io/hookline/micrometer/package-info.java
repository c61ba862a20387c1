/**
 * Micrometer bindings for hookline's {@link io.hookline.spi.MetricsExporter}.
 */
package io.hookline.micrometer;
