package com.machina.provisioning.terraform;

import java.util.List;

/**
 * @param stdout full stdout, only populated when the command was run with capture enabled
 * @param tail last lines of combined output
 */
public record CommandResult(int exitCode, String stdout, List<String> tail) {
}
