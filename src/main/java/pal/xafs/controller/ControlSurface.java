package pal.xafs.controller;

/**
 * Controller widgets the orchestrator locks while a scan runs.
 */
public interface ControlSurface {

    void setControlsEnabled(boolean enabled);

    void setAbortEnabled(boolean enabled);
}
