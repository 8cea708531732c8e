package com.machina.provisioning.terraform;

/**
 * @param rawPlan human-readable plan text
 */
public record PlanResult(PlanSummary summary, String rawPlan) {
}
