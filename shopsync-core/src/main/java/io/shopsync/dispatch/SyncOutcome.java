package io.shopsync.dispatch;

import io.shopsync.model.IdResolution;
import io.shopsync.model.RecordRef;

import java.util.ArrayList;
import java.util.List;

/**
 * What the dispatcher should record locally after a successful replay: identifier
 * resolutions to apply and rows that now match the remote backend.
 *
 * <p>Resolutions are applied before rows are marked synced, so {@link #synced()} refers to
 * rows by their persistent ids.
 */
public record SyncOutcome(List<IdResolution> resolutions, List<RecordRef> synced) {

    public SyncOutcome {
        resolutions = List.copyOf(resolutions);
        synced = List.copyOf(synced);
    }

    public static SyncOutcome none() {
        return new SyncOutcome(List.of(), List.of());
    }

    public static SyncOutcome synced(RecordRef... refs) {
        return new SyncOutcome(List.of(), List.of(refs));
    }

    public SyncOutcome withResolution(IdResolution resolution) {
        List<IdResolution> all = new ArrayList<>(resolutions);
        all.add(resolution);
        return new SyncOutcome(all, synced);
    }

    public SyncOutcome withSynced(RecordRef ref) {
        List<RecordRef> all = new ArrayList<>(synced);
        all.add(ref);
        return new SyncOutcome(resolutions, all);
    }
}
