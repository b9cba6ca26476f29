package com.govcomms.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * GovComms Collector Service Application
 *
 * - Incremental crawling of registered blog and video sources
 * - Deduplicated ingestion into the item store
 * - Staleness-driven rendering of per-source and global analytics assets
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
