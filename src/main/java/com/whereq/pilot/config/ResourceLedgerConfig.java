package com.whereq.pilot.config;

import com.whereq.pilot.resource.LookupIntervals;
import com.whereq.pilot.resource.ResourceDetector;
import com.whereq.pilot.resource.ResourceLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Node-local resource ledger, only built on worker nodes
 */
@Configuration
@ConditionalOnProperty(prefix = "pilot.ledger", name = "enabled", havingValue = "true")
public class ResourceLedgerConfig {

    @Bean
    public ResourceDetector resourceDetector() {
        return new ResourceDetector();
    }

    @Bean
    public ResourceLedger resourceLedger(PilotProperties properties, ResourceDetector detector) {
        PilotProperties.LedgerConfig ledger = properties.getLedger();
        return ResourceLedger.builder()
            .total(detector.detect(ledger.getResources()))
            .lookupIntervals(ledger.isDebug() ? LookupIntervals.debug() : LookupIntervals.defaults())
            .build();
    }
}
