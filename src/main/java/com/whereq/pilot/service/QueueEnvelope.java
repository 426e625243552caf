package com.whereq.pilot.service;

import com.whereq.pilot.config.PilotProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Identity and capacity envelope of this queue host: which pilots it owns
 * and which tasks it asks the queue service for.
 */
@Slf4j
@Component
public class QueueEnvelope {

    @Autowired
    private PilotProperties properties;

    @Autowired
    private BatchAdapterFactory adapterFactory;

    private String queueHost;

    private String site;

    private Map<String, Object> resources;

    private Map<String, Object> queryParams;

    @PostConstruct
    public void initialize() {
        queueHost = properties.getQueueHost() == null || properties.getQueueHost().isBlank()
            ? localHostName()
            : properties.getQueueHost();
        site = adapterFactory.getAdapter().getSite();

        Map<String, Object> envelope = new LinkedHashMap<>(properties.getQueue().getResources());
        envelope.put("site", site);
        String lower = site.toLowerCase(Locale.ROOT);
        if (lower.contains("gpu")) {
            envelope.put("gpu", 1);
        } else if (lower.contains("cpu")) {
            envelope.put("gpu", 0);
        }
        resources = Collections.unmodifiableMap(envelope);

        Map<String, Object> params = new LinkedHashMap<>();
        if (properties.getQueue().isExclusive()) {
            params.put("requirements.site", site);
        }
        queryParams = Collections.unmodifiableMap(params);

        log.info("Queue host {} at site {}, resources: {}, query params: {}", queueHost, site, resources, queryParams);
    }

    public String getQueueHost() {
        return queueHost;
    }

    public String getSite() {
        return site;
    }

    /**
     * Capacity envelope of one pilot, including the site
     */
    public Map<String, Object> getResources() {
        return resources;
    }

    public Map<String, Object> getQueryParams() {
        return queryParams;
    }

    /**
     * Version stamped on pilot records
     */
    public String getVersion() {
        String version = getClass().getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, using localhost: {}", e.getMessage());
            return "localhost";
        }
    }
}
