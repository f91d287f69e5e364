package com.acme.vision.framebus.pipeline;

public sealed interface DepositResult permits DepositResult.Stored, DepositResult.Replaced, DepositResult.Rejected {
    record Stored() implements DepositResult {}
    record Replaced(long droppedFrameId) implements DepositResult {}
    record Rejected() implements DepositResult {}
}
