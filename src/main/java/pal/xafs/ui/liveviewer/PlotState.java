package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.PlotSeries;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Tracks what the canvas currently displays and forwards changes to it on the render executor.
 * A curve whose data did not change is not redrawn.
 */
public class PlotState {
    private static final Logger logger = LoggerFactory.getLogger(PlotState.class);

    private final PlotCanvas canvas;
    private final Executor renderExecutor;
    private final Map<String, PlotSeries> displayed = new ConcurrentHashMap<>();

    public PlotState(PlotCanvas canvas, Executor renderExecutor) {
        this.canvas = canvas;
        this.renderExecutor = renderExecutor;
    }

    /**
     * @return true if the series differed from the displayed one and a redraw was scheduled
     */
    public boolean publish(PlotSeries series) {
        PlotSeries previous = displayed.get(series.legend());
        if (series.sameData(previous)) {
            return false;
        }
        displayed.put(series.legend(), series);
        render(c -> c.addCurve(series));
        return true;
    }

    /**
     * @return true if the curve was displayed
     */
    public boolean remove(String legend) {
        if (displayed.remove(legend) == null) {
            return false;
        }
        render(c -> c.removeCurve(legend));
        return true;
    }

    public void clear() {
        displayed.clear();
        render(PlotCanvas::clearCurves);
    }

    public PlotSeries displayed(String legend) {
        return displayed.get(legend);
    }

    public int curveCount() {
        return displayed.size();
    }

    /**
     * Runs an arbitrary canvas mutation on the render executor.
     */
    public void render(Consumer<PlotCanvas> action) {
        renderExecutor.execute(() -> {
            try {
                action.accept(canvas);
            } catch (RuntimeException e) {
                logger.error("Canvas update failed", e);
            }
        });
    }
}
