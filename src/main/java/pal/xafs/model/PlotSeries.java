package pal.xafs.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named curve as handed to the plot surface.
 */
public final class PlotSeries {

    public enum YAxisSide { LEFT, RIGHT }

    private final String legend;
    private final double[] x;
    private final double[] y;
    private final int zOrder;
    private final String color;
    private final YAxisSide yAxis;

    public PlotSeries(String legend, double[] x, double[] y, int zOrder, String color, YAxisSide yAxis) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y lengths differ: " + x.length + " vs " + y.length);
        }
        this.legend = Objects.requireNonNull(legend);
        this.x = x.clone();
        this.y = y.clone();
        this.zOrder = zOrder;
        this.color = color;
        this.yAxis = yAxis;
    }

    public static PlotSeries empty(String legend, int zOrder, String color) {
        return new PlotSeries(legend, new double[0], new double[0], zOrder, color, YAxisSide.LEFT);
    }

    public String legend() {
        return legend;
    }

    public double[] x() {
        return x.clone();
    }

    public double[] y() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    public int zOrder() {
        return zOrder;
    }

    public String color() {
        return color;
    }

    public YAxisSide yAxis() {
        return yAxis;
    }

    /**
     * Elementwise comparison of the data arrays only; styling is ignored.
     *
     * @param other previously displayed series, may be null
     * @return true if both x and y match element for element
     */
    public boolean sameData(PlotSeries other) {
        return other != null && Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlotSeries other)) return false;
        return zOrder == other.zOrder
                && legend.equals(other.legend)
                && Objects.equals(color, other.color)
                && yAxis == other.yAxis
                && sameData(other);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(legend, zOrder, color, yAxis);
        result = 31 * result + Arrays.hashCode(x);
        result = 31 * result + Arrays.hashCode(y);
        return result;
    }

    @Override
    public String toString() {
        return String.format("PlotSeries{%s, %d points, z=%d, %s}", legend, x.length, zOrder, color);
    }
}
