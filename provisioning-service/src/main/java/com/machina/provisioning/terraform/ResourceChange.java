package com.machina.provisioning.terraform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One resource-level change in a plan, normalized from Terraform's action lists.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceChange(
    String address,
    Action action,
    String resourceType,
    String name
) {

    public enum Action {
        CREATE("create"),
        UPDATE("update"),
        DELETE("delete"),
        REPLACE("replace"),
        READ("read");

        private final String value;

        Action(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Action fromValue(String value) {
            for (Action action : values()) {
                if (action.value.equalsIgnoreCase(value)) {
                    return action;
                }
            }
            throw new IllegalArgumentException("Unknown resource action: " + value);
        }
    }

    /**
     * Whether applying this change removes an existing resource (delete or replace).
     */
    public boolean isDestructive() {
        return action == Action.DELETE || action == Action.REPLACE;
    }
}
