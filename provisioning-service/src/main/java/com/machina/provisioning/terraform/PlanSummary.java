package com.machina.provisioning.terraform;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Normalized counts and resource changes an apply would make.
 *
 * Counting follows Terraform: a replace adds one and destroys one.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanSummary(
    int resourcesToAdd,
    int resourcesToChange,
    int resourcesToDestroy,
    List<ResourceChange> resourceChanges
) {

    public PlanSummary {
        resourceChanges = resourceChanges == null ? List.of() : List.copyOf(resourceChanges);
    }

    public static PlanSummary of(List<ResourceChange> changes) {
        int add = 0;
        int change = 0;
        int destroy = 0;
        for (ResourceChange rc : changes) {
            switch (rc.action()) {
                case CREATE -> add++;
                case UPDATE -> change++;
                case DELETE -> destroy++;
                case REPLACE -> {
                    add++;
                    destroy++;
                }
                case READ -> {
                    // data source reads do not change infrastructure
                }
            }
        }
        return new PlanSummary(add, change, destroy, changes);
    }

    public static PlanSummary empty() {
        return new PlanSummary(0, 0, 0, List.of());
    }

    @JsonIgnore
    public int totalChanges() {
        return resourcesToAdd + resourcesToChange + resourcesToDestroy;
    }

    @JsonIgnore
    public boolean hasDestroys() {
        return resourcesToDestroy > 0;
    }
}
