package com.txlens.pipeline;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by {@link BaggagePipeline#register} when a registration would leave the tool set invalid.
 * The rejected registration is never applied.
 */
@Getter
public class PipelineConstructionException extends PipelineException {

    public enum Reason {
        DUPLICATE_NAME,
        MISSING_DEPENDENCY,
        CYCLE
    }

    private final Reason reason;
    /** Tool being registered (duplicate) or the dependent that references a missing tool. */
    private final String toolName;
    /** Missing dependency name; null for other reasons. */
    private final String dependencyName;
    /** For CYCLE: tools the scheduler could not order, in registration order. */
    private final List<String> unresolvedTools;
    /** For CYCLE: one concrete cycle, first element repeated at the end (A -> B -> A). */
    private final List<String> cyclePath;

    private PipelineConstructionException(Reason reason, String message, String toolName, String dependencyName,
                                          List<String> unresolvedTools, List<String> cyclePath) {
        super(message);
        this.reason = reason;
        this.toolName = toolName;
        this.dependencyName = dependencyName;
        this.unresolvedTools = unresolvedTools;
        this.cyclePath = cyclePath;
    }

    public static PipelineConstructionException duplicateName(String toolName) {
        return new PipelineConstructionException(Reason.DUPLICATE_NAME,
                "Tool with name " + toolName + " already exists",
                toolName, null, List.of(), List.of());
    }

    public static PipelineConstructionException missingDependency(String toolName, String dependencyName) {
        return new PipelineConstructionException(Reason.MISSING_DEPENDENCY,
                "Tool " + toolName + " depends on " + dependencyName + ", but " + dependencyName + " is not registered",
                toolName, dependencyName, List.of(), List.of());
    }

    public static PipelineConstructionException cycle(List<String> unresolvedTools, List<String> cyclePath) {
        return new PipelineConstructionException(Reason.CYCLE,
                "Circular dependency detected among tools " + unresolvedTools + ": " + String.join(" -> ", cyclePath),
                null, null, List.copyOf(unresolvedTools), List.copyOf(cyclePath));
    }
}
