package com.machina.provisioning.terraform;

public enum PlanMode {

    NORMAL("tfplan", null),
    DESTROY("destroy.tfplan", "-destroy"),
    REFRESH_ONLY("refresh.tfplan", "-refresh-only");

    private final String planFile;
    private final String flag;

    PlanMode(String planFile, String flag) {
        this.planFile = planFile;
        this.flag = flag;
    }

    public String getPlanFile() {
        return planFile;
    }

    /**
     * Extra plan flag, or null for a normal plan.
     */
    public String getFlag() {
        return flag;
    }
}
