package com.machina.provisioning.terraform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.exception.ExecutionFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code terraform show -json <planfile>} output into a {@link PlanSummary}.
 *
 * Action lists map as: [create] → create, [update] → update, [delete] → delete,
 * [delete, create] or [create, delete] → replace, [read] → read. [no-op] is dropped.
 */
@Component
@RequiredArgsConstructor
public class TerraformPlanParser {

    private final ObjectMapper objectMapper;

    public PlanSummary parse(String planJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(planJson);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailedException("Plan output is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExecutionFailedException("Plan output is not a JSON object", -1, List.of());
        }

        List<ResourceChange> changes = new ArrayList<>();
        for (JsonNode rc : root.path("resource_changes")) {
            ResourceChange.Action action = toAction(rc.path("change").path("actions"));
            if (action == null) {
                continue;
            }
            changes.add(new ResourceChange(
                rc.path("address").asText(),
                action,
                rc.path("type").asText(null),
                rc.path("name").asText(null)
            ));
        }
        return PlanSummary.of(changes);
    }

    static ResourceChange.Action toAction(JsonNode actions) {
        List<String> list = new ArrayList<>();
        actions.forEach(a -> list.add(a.asText()));

        if (list.size() == 2 && list.contains("delete") && list.contains("create")) {
            return ResourceChange.Action.REPLACE;
        }
        if (list.size() != 1) {
            return null;
        }
        return switch (list.get(0)) {
            case "create" -> ResourceChange.Action.CREATE;
            case "update" -> ResourceChange.Action.UPDATE;
            case "delete" -> ResourceChange.Action.DELETE;
            case "read" -> ResourceChange.Action.READ;
            default -> null;
        };
    }
}
