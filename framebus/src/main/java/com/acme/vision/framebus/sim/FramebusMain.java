package com.acme.vision.framebus.sim;

import com.acme.vision.framebus.config.PipelineConfig;
import com.acme.vision.framebus.pipeline.FramePipeline;
import com.acme.vision.framebus.telemetry.AtomicPipelineMetrics;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the pipeline against the simulated camera until the JVM is asked to stop.
 */
public final class FramebusMain {
    private static final Logger LOG = Logger.getLogger(FramebusMain.class.getName());

    private FramebusMain() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        PipelineConfig config = PipelineConfig.fromEnv(env);
        SimulationSettings settings = SimulationSettings.fromEnv(env);
        boolean freeRunning = config.softwareTriggerRateHz() <= 0.0d;
        SimulatedCameraDevice device = new SimulatedCameraDevice(
            "sim-" + config.nodeName(), config.configuredStreams(), settings, freeRunning);

        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        FramePipeline pipeline = FramePipeline.builder(device, LoggingImageSink::new)
            .config(config)
            .metrics(metrics)
            .build();

        Thread shutdownHook = new Thread(pipeline::close, "framebus-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        LOG.info(() -> "Starting framebus node=" + config.nodeName() + " streams=" + config.configuredStreams()
            + " sim=" + settings.width() + "x" + settings.height() + "@" + settings.fps()
            + " parts=" + settings.parts() + " format=" + settings.pixelFormat());
        try {
            if (!pipeline.start()) {
                LOG.severe("Frame pipeline failed to start");
                return;
            }
            pipeline.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOG.fine("Shutdown already in progress");
            }
            pipeline.close();
        }
    }
}
