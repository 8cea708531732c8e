package com.machina.provisioning.dto.response;

public record MachineCreatedResponse(MachineResponse machine, DeploymentResponse deployment) {}
