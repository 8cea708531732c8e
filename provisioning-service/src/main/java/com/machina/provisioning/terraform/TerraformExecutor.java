package com.machina.provisioning.terraform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.exception.ExecutionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan/apply/destroy against a machine's workspace.
 *
 * Callers acquire a workspace, run operations, and must call {@link #cleanup(Workspace)}
 * in a finally block.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerraformExecutor {

    private final TerraformCommandRunner runner;
    private final WorkspaceManager workspaceManager;
    private final TerraformPlanParser planParser;
    private final ObjectMapper objectMapper;

    public Workspace open(String workspaceName, String module) {
        return workspaceManager.acquire(workspaceName, module);
    }

    public void init(Workspace workspace, ExecutionContext context) {
        context.getLogSink().info("Initializing Terraform workspace " + workspace.getName());
        runner.run(workspace.getDirectory(), List.of("init", "-input=false", "-no-color"), context);
    }

    public PlanResult plan(Workspace workspace, Map<String, Object> variables, PlanMode mode, ExecutionContext context) {
        workspaceManager.writeVariables(workspace, variables);
        context.getLogSink().info("Planning changes (" + mode.name().toLowerCase() + ")");

        List<String> args = new ArrayList<>(List.of("plan", "-input=false", "-no-color", "-out=" + mode.getPlanFile()));
        if (mode.getFlag() != null) {
            args.add(mode.getFlag());
        }
        runner.run(workspace.getDirectory(), args, context);
        workspace.recordPlan(mode);

        String rawPlan = runner.capture(workspace.getDirectory(),
            List.of("show", "-no-color", mode.getPlanFile()), context).stdout();
        String planJson = runner.capture(workspace.getDirectory(),
            List.of("show", "-json", mode.getPlanFile()), context).stdout();

        PlanSummary summary = planParser.parse(planJson);
        context.getLogSink().info(String.format("Plan: %d to add, %d to change, %d to destroy",
            summary.resourcesToAdd(), summary.resourcesToChange(), summary.resourcesToDestroy()));
        return new PlanResult(summary, rawPlan);
    }

    /**
     * Apply the saved plan and return the module outputs as plain values.
     */
    public Map<String, Object> apply(Workspace workspace, ExecutionContext context) {
        context.getLogSink().info("Applying plan");
        applyPlanFile(workspace, context);
        return outputs(workspace, context);
    }

    /**
     * Apply a saved destroy plan. Fails if the last plan was not a destroy plan.
     */
    public void destroy(Workspace workspace, ExecutionContext context) {
        if (workspace.getPlannedMode() != PlanMode.DESTROY) {
            throw new IllegalStateException("Workspace " + workspace.getName() + " has no destroy plan");
        }
        context.getLogSink().info("Destroying resources");
        applyPlanFile(workspace, context);
    }

    public Map<String, Object> outputs(Workspace workspace, ExecutionContext context) {
        String json = runner.capture(workspace.getDirectory(), List.of("output", "-json"), context).stdout();
        return simplifyOutputs(json);
    }

    /**
     * Always safe to call; removes variables and plan files.
     */
    public void cleanup(Workspace workspace) {
        workspaceManager.cleanup(workspace);
    }

    private void applyPlanFile(Workspace workspace, ExecutionContext context) {
        runner.run(workspace.getDirectory(), List.of(
            "apply", "-input=false", "-no-color", "-auto-approve",
            workspace.planFile().getFileName().toString()
        ), context);
    }

    /**
     * {@code {"public_ip": {"value": "1.2.3.4", "type": "string"}}} → {@code {"public_ip": "1.2.3.4"}}
     */
    Map<String, Object> simplifyOutputs(String json) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return outputs;
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().path("sensitive").asBoolean(false)) {
                    continue;
                }
                JsonNode value = field.getValue().path("value");
                outputs.put(field.getKey(), value.isMissingNode() ? null : objectMapper.treeToValue(value, Object.class));
            }
        } catch (JsonProcessingException e) {
            throw new ExecutionFailedException("Terraform outputs are not valid JSON", e);
        }
        return outputs;
    }
}
