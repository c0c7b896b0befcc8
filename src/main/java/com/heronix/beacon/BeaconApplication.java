package com.heronix.beacon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

import com.heronix.beacon.config.BeaconProperties;

/**
 * Heronix Beacon - Remote Network Monitoring Back End
 *
 * A local collector ("agent") on the user's private network reports the devices
 * it discovers to Beacon. Each agent authenticates with a bearer credential that
 * is bound to exactly one agent installation, and that binding must be approved
 * by the credential's owner before the agent is trusted.
 *
 * Core Principle: a credential belongs to one installation, and stored devices
 * always converge to what that installation last reported.
 */
@SpringBootApplication
@EnableConfigurationProperties(BeaconProperties.class)
@EnableAsync
public class BeaconApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeaconApplication.class, args);
    }
}
