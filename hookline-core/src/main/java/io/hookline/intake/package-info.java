/**
 * Event intake and fan-out.
 */
package io.hookline.intake;
