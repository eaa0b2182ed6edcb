package io.shopsync.spi;

@FunctionalInterface
public interface ConnectivityListener {
    void onConnectivityChanged(boolean online);
}
