package com.acme.vision.framebus.pipeline;

import com.acme.vision.framebus.telemetry.DropReason;

public sealed interface RouteResult permits RouteResult.Routed, RouteResult.Returned {
    record Routed(int deliveries) implements RouteResult {}
    record Returned(DropReason reason) implements RouteResult {}
}
