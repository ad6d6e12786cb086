package com.hltvsync.domain.ports;

import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.UnitOfWork;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for the per-unit extraction snapshots.
 */
public interface SnapshotStore {

    /**
     * Writes the snapshot of a completed unit. Best effort: failures are logged, not thrown.
     */
    void emit(UnitOfWork unit, Extraction extraction);

    /**
     * Reads every snapshot under the directory, ordered by dependency level then path.
     */
    List<Extraction> loadAll(Path directory) throws IOException;
}
