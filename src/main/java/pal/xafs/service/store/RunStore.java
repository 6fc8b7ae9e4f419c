package pal.xafs.service.store;

import pal.xafs.model.ScanCategory;

import java.util.List;

/**
 * Persisted runs, searchable by scan category.
 */
public interface RunStore {

    /**
     * @return up to {@code limit} runs of the category, newest first
     */
    List<RunRecord> latest(ScanCategory category, int limit);

    void add(RunRecord run);
}
