package pal.xafs.service.hardware;

import pal.xafs.model.Channel;

/**
 * Buffered arrays filled by the counter during a fly scan.
 */
public enum WaveformChannel {
    ENCODER,
    I0,
    IT,
    IF,
    IR;

    public static WaveformChannel of(Channel channel) {
        return switch (channel) {
            case I0 -> I0;
            case IT -> IT;
            case IF -> IF;
            case IR -> IR;
        };
    }
}
