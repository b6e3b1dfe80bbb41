package com.debtchecker.output;

import com.debtchecker.model.CheckpointSnapshot;

import java.util.Optional;

public interface CheckpointStore {

    /**
     * Load the last persisted snapshot, if any.
     */
    Optional<CheckpointSnapshot> load();

    /**
     * Persist a snapshot. Readers never observe a partially written file.
     */
    void save(CheckpointSnapshot snapshot);

    /**
     * Remove the persisted snapshot once its run completed and its output is written.
     */
    void clear();
}
