package com.z254.arbiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ARBITER - Adaptive governance decision engine.
 *
 * <p>ARBITER provides:
 * <ul>
 *   <li>Decisions - ALLOW, DENY, ESCALATE or MONITOR with confidence and reasoning</li>
 *   <li>Model lifecycle - versioned registry, promotion, rollback and A/B tests</li>
 *   <li>Online learning - incremental updates from reviewer corrections</li>
 *   <li>Drift monitoring - distribution checks over logged features</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class ArbiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbiterApplication.class, args);
    }
}
