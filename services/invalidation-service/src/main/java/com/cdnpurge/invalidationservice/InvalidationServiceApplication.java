package com.cdnpurge.invalidationservice;

import com.cdnpurge.invalidationservice.config.DispatchProperties;
import com.cdnpurge.invalidationservice.config.InvalidationServiceProperties;
import com.cdnpurge.invalidationservice.config.TenantProvidersProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CDN invalidation service.
 *
 * <p>Accepts changed content paths from the publish pipeline, splits them into provider-sized
 * batches and purges them from the tenant's CDN in the background.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        InvalidationServiceProperties.class,
        DispatchProperties.class,
        TenantProvidersProperties.class
})
public class InvalidationServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(InvalidationServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(InvalidationServiceApplication.class, args);
        log.info("CDN invalidation service started");
    }
}
