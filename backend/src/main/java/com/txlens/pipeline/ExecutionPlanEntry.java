package com.txlens.pipeline;

import java.util.List;

/**
 * One line of the execution plan: 1-based position, tool name and its declared dependencies.
 */
public record ExecutionPlanEntry(int position, String toolName, List<String> dependencies) {

    @Override
    public String toString() {
        return dependencies.isEmpty()
                ? position + ". " + toolName + " (no dependencies)"
                : position + ". " + toolName + " (depends on: " + dependencies + ")";
    }
}
