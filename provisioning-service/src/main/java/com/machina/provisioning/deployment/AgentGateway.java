package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.terraform.LogSink;

/**
 * Channel to the agent running on a machine. Service restarts go through it rather than
 * through Terraform or the provider API.
 */
public interface AgentGateway {

    /**
     * @throws AgentUnavailableException when no agent can be reached on the machine
     */
    void restartService(Machine machine, String serviceName, LogSink logSink);
}
