package pal.xafs.controller;

import pal.xafs.model.Channel;

import java.io.IOException;
import java.util.Map;

/**
 * Gated counter behind the amplifiers.
 */
public interface ScalerCounter {

    /**
     * Counts for the given preset time and returns the accumulated counts per channel.
     */
    Map<Channel, Double> count(double seconds) throws IOException;
}
