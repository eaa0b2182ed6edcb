/**
 * Micrometer bridge for sync and sale metrics.
 */
package io.shopsync.micrometer;
