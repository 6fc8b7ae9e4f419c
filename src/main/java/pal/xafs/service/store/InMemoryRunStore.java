package pal.xafs.service.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.ScanCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Run store kept in memory for the lifetime of the process.
 */
public class InMemoryRunStore implements RunStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryRunStore.class);

    private final List<RunRecord> runs = new CopyOnWriteArrayList<>();

    @Override
    public void add(RunRecord run) {
        runs.add(run);
        logger.debug("Stored run {}", run.uid());
    }

    @Override
    public List<RunRecord> latest(ScanCategory category, int limit) {
        List<RunRecord> result = new ArrayList<>();
        for (int i = runs.size() - 1; i >= 0 && result.size() < limit; i--) {
            RunRecord run = runs.get(i);
            String scanType = run.start().has("scan_type") ? run.start().get("scan_type").getAsString() : null;
            if (ScanCategory.fromScanType(scanType) == category) {
                result.add(run);
            }
        }
        return result;
    }

    public int size() {
        return runs.size();
    }
}
