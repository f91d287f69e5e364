package com.acme.vision.framebus.sink;

import com.acme.vision.framebus.config.SubstreamLayout;

/**
 * Creates one sink per substream during pipeline setup.
 */
@FunctionalInterface
public interface SinkFactory {
    /**
     * @param layout               naming of the substream the sink serves
     * @param onSubscriptionChange to be invoked whenever the sink gains or loses its
     *                             last subscriber
     */
    ImageSink open(SubstreamLayout layout, Runnable onSubscriptionChange);
}
