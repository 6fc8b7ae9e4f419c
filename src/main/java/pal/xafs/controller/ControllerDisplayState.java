package pal.xafs.controller;

import pal.xafs.model.ScanCategory;

/**
 * Values the controller displays that arrive from the viewer or the run engine.
 */
public class ControllerDisplayState {

    private int progress;
    private String peakEnergy = "";
    private String energyDifference = "";
    private String dcmI0 = "";
    private String dcmI0Second = "";
    private String engineState = "idle";
    private ScanCategory currentTab = ScanCategory.MEASURE;

    public synchronized int getProgress() {
        return progress;
    }

    public synchronized void setProgress(int progress) {
        this.progress = Math.max(0, Math.min(100, progress));
    }

    public synchronized String getPeakEnergy() {
        return peakEnergy;
    }

    public synchronized void setPeakEnergy(String peakEnergy) {
        this.peakEnergy = peakEnergy;
    }

    public synchronized String getEnergyDifference() {
        return energyDifference;
    }

    public synchronized void setEnergyDifference(String energyDifference) {
        this.energyDifference = energyDifference;
    }

    public synchronized String getDcmI0() {
        return dcmI0;
    }

    public synchronized void setDcmI0(String dcmI0) {
        this.dcmI0 = dcmI0;
    }

    public synchronized String getDcmI0Second() {
        return dcmI0Second;
    }

    public synchronized void setDcmI0Second(String dcmI0Second) {
        this.dcmI0Second = dcmI0Second;
    }

    public synchronized String getEngineState() {
        return engineState;
    }

    public synchronized void setEngineState(String engineState) {
        this.engineState = engineState;
    }

    public synchronized ScanCategory getCurrentTab() {
        return currentTab;
    }

    public synchronized void setCurrentTab(ScanCategory currentTab) {
        this.currentTab = currentTab;
    }
}
