package pal.xafs.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-channel dark rates in counts per second, measured with the photon shutter closed.
 */
public final class DarkCurrent {

    private static final DarkCurrent NONE = new DarkCurrent(0, 0, 0, 0);

    private final EnumMap<Channel, Double> rates = new EnumMap<>(Channel.class);

    public DarkCurrent(double i0, double it, double iF, double ir) {
        rates.put(Channel.I0, i0);
        rates.put(Channel.IT, it);
        rates.put(Channel.IF, iF);
        rates.put(Channel.IR, ir);
    }

    /**
     * @return zero rates, used by fly scans which are not dark-corrected
     */
    public static DarkCurrent none() {
        return NONE;
    }

    public double rate(Channel channel) {
        return rates.get(channel);
    }

    public Map<Channel, Double> asMap() {
        return new EnumMap<>(rates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DarkCurrent other)) return false;
        return rates.equals(other.rates);
    }

    @Override
    public int hashCode() {
        return rates.hashCode();
    }

    @Override
    public String toString() {
        return "DarkCurrent" + rates;
    }
}
