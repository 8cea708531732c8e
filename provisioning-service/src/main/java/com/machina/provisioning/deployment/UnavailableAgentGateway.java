package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.terraform.LogSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default gateway when no machine agent integration is deployed.
 */
@Component
@Slf4j
public class UnavailableAgentGateway implements AgentGateway {

    @Override
    public void restartService(Machine machine, String serviceName, LogSink logSink) {
        log.warn("Restart of {} on machine {} requested but no agent gateway is configured",
            serviceName, machine.getId());
        throw new AgentUnavailableException("No agent connection available for machine " + machine.getId());
    }
}
