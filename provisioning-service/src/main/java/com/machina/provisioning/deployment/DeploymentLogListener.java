package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.DeploymentState;

/**
 * Live subscriber of one deployment's log. Callbacks arrive in sequence order, never concurrently.
 */
public interface DeploymentLogListener {

    void onLog(DeploymentLogLine line) throws Exception;

    void onComplete(DeploymentState finalState) throws Exception;
}
