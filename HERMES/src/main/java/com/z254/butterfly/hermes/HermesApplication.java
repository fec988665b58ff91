package com.z254.butterfly.hermes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HERMES - Message Routing and Sub-Agent Delegation for the BUTTERFLY Ecosystem.
 *
 * <p>HERMES provides:
 * <ul>
 *   <li>Message Routing - Point-to-point and broadcast delivery with load balancing</li>
 *   <li>Resilience - Per-server circuit breakers with capability-based failover</li>
 *   <li>Sub-Agent Delegation - Parallel, sequential, pipeline and adaptive task strategies</li>
 *   <li>Result Aggregation - Merge, best-of, vote and weighted-average combination</li>
 *   <li>Capacity Planning - Agent health, load balancing and scaling recommendations</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class HermesApplication {

    public static void main(String[] args) {
        SpringApplication.run(HermesApplication.class, args);
    }
}
