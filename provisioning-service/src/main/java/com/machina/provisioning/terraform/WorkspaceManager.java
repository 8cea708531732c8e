package com.machina.provisioning.terraform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.exception.ExecutionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the on-disk workspaces, one directory per machine under {@code terraform.workspaces-dir}.
 */
@Component
@Slf4j
public class WorkspaceManager {

    static final String VARS_FILE = "terraform.tfvars.json";

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");
    private static final List<String> TEMPORARY_FILES = List.of(
        VARS_FILE,
        PlanMode.NORMAL.getPlanFile(),
        PlanMode.DESTROY.getPlanFile(),
        PlanMode.REFRESH_ONLY.getPlanFile(),
        "crash.log"
    );

    private final Path root;
    private final String moduleRoot;
    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public WorkspaceManager(
        @Value("${terraform.workspaces-dir:.terraform-workspaces}") String workspacesDir,
        @Value("${terraform.module-root:classpath:terraform/modules}") String moduleRoot,
        ObjectMapper objectMapper
    ) {
        this.root = Paths.get(workspacesDir).toAbsolutePath().normalize();
        this.moduleRoot = moduleRoot.endsWith("/") ? moduleRoot.substring(0, moduleRoot.length() - 1) : moduleRoot;
        this.objectMapper = objectMapper;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Create (or reopen) a workspace and stage the provider module's .tf files into it.
     */
    public Workspace acquire(String name, String module) {
        Path dir = resolve(name);
        try {
            Files.createDirectories(dir);
            int copied = stageModule(module, dir);
            log.debug("Workspace {} ready with {} module files from {}", name, copied, module);
        } catch (IOException e) {
            throw new ExecutionFailedException("Failed to prepare workspace " + name, e);
        }
        return new Workspace(name, dir, module);
    }

    /**
     * Write the input variables. The file may hold provider tokens, so it is owner-only
     * and deleted by {@link #cleanup(Workspace)}.
     */
    public void writeVariables(Workspace workspace, Map<String, Object> variables) {
        Path file = workspace.getDirectory().resolve(VARS_FILE);
        try {
            objectMapper.writeValue(file.toFile(), variables);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            }
        } catch (IOException e) {
            throw new ExecutionFailedException("Failed to write variables for workspace " + workspace.getName(), e);
        }
    }

    /**
     * Remove temporary files (variables, plans, crash logs). State is kept.
     */
    public void cleanup(Workspace workspace) {
        cleanup(workspace.getName());
    }

    public void cleanup(String name) {
        Path dir = resolve(name);
        for (String file : TEMPORARY_FILES) {
            try {
                Files.deleteIfExists(dir.resolve(file));
            } catch (IOException e) {
                log.error("Failed to delete {} from workspace {}: {}", file, name, e.getMessage());
            }
        }
    }

    /**
     * Delete the whole workspace, state included. Only valid once the machine is destroyed.
     */
    public void remove(String name) {
        Path dir = resolve(name);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            log.info("Removed workspace {}", name);
        } catch (IOException e) {
            throw new ExecutionFailedException("Failed to remove workspace " + name, e);
        }
    }

    public boolean exists(String name) {
        return Files.isDirectory(resolve(name));
    }

    public List<String> listWorkspaces() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .forEach(names::add);
        } catch (IOException e) {
            throw new ExecutionFailedException("Failed to list workspaces in " + root, e);
        }
        return names;
    }

    private int stageModule(String module, Path target) throws IOException {
        Resource[] resources = resolver.getResources(moduleRoot + "/" + module + "/*.tf");
        if (resources.length == 0) {
            throw new IOException("No Terraform files found for module " + module + " under " + moduleRoot);
        }
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null) {
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                Files.copy(in, target.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        return resources.length;
    }

    private Path resolve(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid workspace name: " + name);
        }
        Path dir = root.resolve(name).normalize();
        if (!dir.getParent().equals(root)) {
            throw new IllegalArgumentException("Workspace escapes root: " + name);
        }
        return dir;
    }
}
