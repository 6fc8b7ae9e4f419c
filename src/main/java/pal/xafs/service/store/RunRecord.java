package pal.xafs.service.store;

import com.google.gson.JsonObject;
import pal.xafs.model.SampleFrame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One run: its start document and the rows of its primary stream.
 * Rows may be appended while a reader takes snapshots.
 */
public class RunRecord {

    private final String uid;
    private final JsonObject start;
    private final Map<String, List<Double>> columns = new LinkedHashMap<>();
    private int rows;

    public RunRecord(JsonObject start) {
        this(UUID.randomUUID().toString(), start);
    }

    public RunRecord(String uid, JsonObject start) {
        this.uid = uid;
        this.start = start.deepCopy();
    }

    public String uid() {
        return uid;
    }

    public JsonObject start() {
        return start.deepCopy();
    }

    public RunMetadata metadata() throws DataUnavailableException {
        return RunMetadata.fromStartDocument(start);
    }

    /**
     * Appends one event of the primary stream. The first row fixes the column set.
     */
    public synchronized void appendRow(Map<String, Double> row) {
        if (rows == 0 && columns.isEmpty()) {
            for (String name : row.keySet()) {
                columns.put(name, new ArrayList<>());
            }
        }
        if (!columns.keySet().equals(row.keySet())) {
            throw new IllegalArgumentException("Row columns " + row.keySet() + " differ from " + columns.keySet());
        }
        for (Map.Entry<String, Double> e : row.entrySet()) {
            columns.get(e.getKey()).add(e.getValue());
        }
        rows++;
    }

    public synchronized int rowCount() {
        return rows;
    }

    /**
     * @return a snapshot of the primary stream, empty when no row was recorded yet
     */
    public synchronized Optional<SampleFrame> primary() {
        if (rows == 0) {
            return Optional.empty();
        }
        Map<String, double[]> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> e : columns.entrySet()) {
            List<Double> values = e.getValue();
            double[] array = new double[values.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = values.get(i);
            }
            snapshot.put(e.getKey(), array);
        }
        return Optional.of(new SampleFrame(snapshot));
    }
}
