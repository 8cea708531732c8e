package com.machina.provisioning.terraform;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A machine's Terraform working directory. Terraform state survives between deployments;
 * variables and plan files are temporary and removed by cleanup.
 */
@Getter
public class Workspace {

    private final String name;
    private final Path directory;
    private final String module;
    private PlanMode plannedMode;

    Workspace(String name, Path directory, String module) {
        this.name = name;
        this.directory = directory;
        this.module = module;
    }

    void recordPlan(PlanMode mode) {
        this.plannedMode = mode;
    }

    public Path planFile() {
        if (plannedMode == null) {
            throw new IllegalStateException("No plan has been produced in workspace " + name);
        }
        return directory.resolve(plannedMode.getPlanFile());
    }
}
