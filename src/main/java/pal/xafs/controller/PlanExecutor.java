package pal.xafs.controller;

import pal.xafs.model.FlySample;
import pal.xafs.service.store.RunMetadata;

import java.io.IOException;
import java.util.List;

/**
 * Executes the individual steps of a scan and records what they read.
 */
public interface PlanExecutor {

    void openRun(RunMetadata metadata) throws IOException;

    void closeRun();

    /** Moves the monochromator and returns once it settled. */
    void moveEnergy(double energy) throws IOException;

    void setDwellTime(double seconds) throws IOException;

    /** Counts for the current dwell time and records one row. */
    void triggerAndRead(int step) throws IOException;

    void recordFlySamples(List<FlySample> samples) throws IOException;
}
