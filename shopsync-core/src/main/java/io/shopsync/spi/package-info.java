/**
 * Service provider interfaces for the collaborators the sync engine talks to: the local
 * store, the remote backend, secure credential storage, connectivity and metrics.
 *
 * <p>{@code shopsync-jdbc} implements the local-store side; the remote backend, credential
 * store and connectivity monitor are supplied by the host application.
 */
package io.shopsync.spi;
