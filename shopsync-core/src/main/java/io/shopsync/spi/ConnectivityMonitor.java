package io.shopsync.spi;

/**
 * Reports whether the remote backend is reachable and announces transitions.
 */
public interface ConnectivityMonitor {

    /**
     * Monitor that always reports online and never fires.
     */
    ConnectivityMonitor ALWAYS_ONLINE = new ConnectivityMonitor() {
        @Override
        public boolean isOnline() {
            return true;
        }

        @Override
        public void addListener(ConnectivityListener listener) {
        }

        @Override
        public void removeListener(ConnectivityListener listener) {
        }
    };

    boolean isOnline();

    void addListener(ConnectivityListener listener);

    void removeListener(ConnectivityListener listener);
}
