package pal.xafs.model;

/**
 * The four ion-chamber counter channels.
 */
public enum Channel {
    /** Incident beam */
    I0("I0"),
    /** Transmitted beam */
    IT("It"),
    /** Fluorescence */
    IF("If"),
    /** Reference foil */
    IR("Ir");

    private final String column;

    Channel(String column) {
        this.column = column;
    }

    /**
     * @return column name of this channel in a run's primary stream
     */
    public String column() {
        return column;
    }
}
