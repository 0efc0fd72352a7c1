package org.driftlens.store;

import java.util.List;
import org.driftlens.snapshot.Snapshot;

/**
 * Persistent collection of snapshots addressed by snapshot id.
 */
public interface SnapshotStore {
    void save(Snapshot snapshot);

    /**
     * @throws org.driftlens.error.NotFoundException if no snapshot has this id
     */
    Snapshot load(String snapshotId);

    boolean contains(String snapshotId);

    /**
     * Stored ids in a stable order.
     */
    List<String> ids();

    List<Snapshot> loadAll();
}
