package com.whereq.pilot.resource;

import com.whereq.pilot.model.ResourceUsage;

/**
 * Receives claims that were terminated for overusage
 */
public interface ClaimViolationHandler {

    /**
     * @param taskId task whose process tree was killed
     * @param reason overusage reason
     * @param usage peak usage of the claim
     */
    void onViolation(String taskId, String reason, ResourceUsage usage);
}
