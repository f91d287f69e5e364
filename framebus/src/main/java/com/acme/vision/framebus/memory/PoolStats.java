package com.acme.vision.framebus.memory;

/**
 * @param allocated buffers or images ever allocated by the pool
 * @param acquired  handles handed out (wraps or recyclable images)
 * @param recycled  handles whose last reference was released
 * @param inFlight  handles currently held
 * @param grown     buffers added under pressure after the initial allocation
 */
public record PoolStats(long allocated, long acquired, long recycled, long inFlight, long grown) {}
