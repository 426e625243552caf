package com.whereq.pilot.resource;

/**
 * Reads gpu utilization
 */
public interface GpuProbe {

    /**
     * Utilization of one device in percent, -1 when it cannot be read
     */
    int utilization(String deviceId);
}
