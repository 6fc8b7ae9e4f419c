package pal.xafs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented block of samples from one run, keyed by column name
 * ({@code time}, {@code dcm_energy}, {@code scaler_time}, {@code I0}, {@code It}, ...).
 * All columns have the same length.
 */
public final class SampleFrame {

    public static final String TIME = "time";
    public static final String ENERGY = "dcm_energy";
    public static final String DWELL = "scaler_time";
    public static final String ENCODER = "ENC";

    private final Map<String, double[]> columns;
    private final int size;

    public SampleFrame(Map<String, double[]> columns) {
        int n = -1;
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] values = e.getValue();
            if (n >= 0 && values.length != n) {
                throw new IllegalArgumentException("Column " + e.getKey() + " has " + values.length
                        + " rows, expected " + n);
            }
            n = values.length;
            copy.put(e.getKey(), values.clone());
        }
        this.columns = Collections.unmodifiableMap(copy);
        this.size = Math.max(n, 0);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean has(String column) {
        return columns.containsKey(column);
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    /**
     * @param column column name
     * @return a copy of the column, or null if absent
     */
    public double[] column(String column) {
        double[] values = columns.get(column);
        return values == null ? null : values.clone();
    }

    public double[] column(Channel channel) {
        return column(channel.column());
    }

    /**
     * @return a copy of this frame with one column replaced or added
     */
    public SampleFrame with(String column, double[] values) {
        Map<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(column, values);
        return new SampleFrame(copy);
    }
}
