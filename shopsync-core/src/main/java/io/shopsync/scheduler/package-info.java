/**
 * Background scheduling of sync drains driven by connectivity and enqueue events.
 */
package io.shopsync.scheduler;
