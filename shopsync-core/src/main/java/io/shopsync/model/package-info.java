/**
 * Records persisted by the local store and replayed to the remote backend.
 */
package io.shopsync.model;
