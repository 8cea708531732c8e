package com.machina.provisioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Deployment and provisioning orchestrator.
 *
 * Turns deploy/destroy/reboot intents into sequenced, auditable infrastructure
 * changes executed through Terraform and reconciled against provider state.
 */
@SpringBootApplication
@EnableScheduling
public class ProvisioningServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvisioningServiceApplication.class, args);
    }
}
