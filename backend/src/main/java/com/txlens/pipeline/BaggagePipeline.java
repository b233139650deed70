package com.txlens.pipeline;

import com.txlens.pipeline.progress.ComponentStatus;
import com.txlens.pipeline.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs registered {@link Tool}s in dependency order against one shared {@link Baggage}.
 * <p>
 * Every registration rebuilds the dependency graph and recomputes the execution order, so duplicate names,
 * dangling dependencies and cycles are rejected when the tool is added, never at run time. A rejected
 * registration leaves the pipeline in its previous state.
 * <p>
 * {@link #execute} walks the order once on the calling thread. The first tool failure stops the run and is
 * rethrown as a {@link ToolExecutionException} naming the tool; baggage written by earlier tools is left as is.
 * An {@link Error} is recorded the same way but rethrown unwrapped.
 * Not thread-safe: one run at a time per instance.
 */
@Slf4j
public class BaggagePipeline {

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final ProgressSink progressSink;

    private List<String> order = List.of();
    private PipelineRunState lastRunState = PipelineRunState.NOT_STARTED;
    private List<ToolRunRecord> lastRunRecords = List.of();

    public BaggagePipeline() {
        this(null);
    }

    /**
     * @param progressSink receives per-tool phase transitions; may be null
     */
    public BaggagePipeline(ProgressSink progressSink) {
        this.progressSink = progressSink;
    }

    /**
     * Adds one tool. All of its dependencies must already be registered.
     *
     * @throws PipelineConstructionException duplicate name, missing dependency or cycle
     */
    public void register(Tool tool) {
        Objects.requireNonNull(tool, "tool");
        registerAll(List.of(tool));
    }

    /**
     * Adds a batch of tools validated together, so the batch may list a tool before its dependencies.
     * Either the whole batch is registered or none of it.
     *
     * @throws PipelineConstructionException duplicate name, missing dependency or cycle
     */
    public void registerAll(Collection<? extends Tool> batch) {
        Objects.requireNonNull(batch, "batch");
        Map<String, Tool> candidate = new LinkedHashMap<>(tools);
        for (Tool tool : batch) {
            String name = requireName(tool);
            if (candidate.putIfAbsent(name, tool) != null) {
                throw PipelineConstructionException.duplicateName(name);
            }
        }
        List<String> newOrder = TopologicalScheduler.schedule(DependencyGraph.build(candidate));

        tools.clear();
        tools.putAll(candidate);
        order = newOrder;
        log.debug("Registered {} tool(s); execution order now {}", batch.size(), order);
    }

    /**
     * Runs every tool once in execution order.
     *
     * @param context cancellation signal threaded into every tool
     * @param baggage shared state; holds the cumulative writes of all tools on success
     * @throws ToolExecutionException when a tool fails or the run is cancelled before a tool starts
     * @throws PipelineException      when no tool is registered
     */
    public void execute(ToolContext context, Baggage baggage) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(baggage, "baggage");
        if (order.isEmpty()) {
            throw new PipelineException("No tools registered or execution order not calculated");
        }

        List<String> runOrder = order;
        List<ToolRunRecord> records = new ArrayList<>(runOrder.size());
        lastRunRecords = Collections.unmodifiableList(records);
        lastRunState = PipelineRunState.RUNNING;

        log.info("Starting pipeline with {} tools", runOrder.size());
        describeExecutionPlan().forEach(entry -> log.info("  {}", entry));

        long pipelineStart = System.nanoTime();
        for (int i = 0; i < runOrder.size(); i++) {
            String name = runOrder.get(i);
            Tool tool = tools.get(name);

            notifyProgress(name, ComponentStatus.INITIATED, "Preparing to start...");
            notifyProgress(name, ComponentStatus.RUNNING, tool.getDescription());
            log.debug("[{}/{}] Running tool '{}': {}", i + 1, runOrder.size(), name, tool.getDescription());

            Instant startedAt = Instant.now();
            long stepStart = System.nanoTime();
            try {
                context.throwIfCancelled();
                tool.process(context, baggage);
            } catch (RuntimeException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - stepStart);
                records.add(ToolRunRecord.failed(name, startedAt, elapsed, e));
                lastRunState = PipelineRunState.FAILED;
                log.error("Tool '{}' FAILED after {}ms: {}", name, elapsed.toMillis(), e.getMessage(), e);
                notifyProgress(name, ComponentStatus.ERROR, "Failed: " + e.getMessage());
                throw new ToolExecutionException(name, e);
            } catch (Error e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - stepStart);
                records.add(ToolRunRecord.failed(name, startedAt, elapsed, e));
                lastRunState = PipelineRunState.FAILED;
                log.error("Tool '{}' FAILED with {} after {}ms", name, e.getClass().getSimpleName(), elapsed.toMillis(), e);
                notifyProgress(name, ComponentStatus.ERROR, "Failed: " + e);
                throw e;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - stepStart);
            records.add(ToolRunRecord.succeeded(name, startedAt, elapsed));
            log.debug("Tool '{}' completed in {}ms", name, elapsed.toMillis());
            notifyProgress(name, ComponentStatus.FINISHED, "Completed in " + elapsed.toMillis() + "ms");
        }

        lastRunState = PipelineRunState.COMPLETED;
        log.info("Pipeline completed in {}ms: {} baggage items across {} tools",
                Duration.ofNanos(System.nanoTime() - pipelineStart).toMillis(), baggage.size(), runOrder.size());
    }

    /** Copy of the current execution order. */
    public List<String> getExecutionOrder() {
        return List.copyOf(order);
    }

    /** Execution order with each tool's declared dependencies, for operators and tests. */
    public List<ExecutionPlanEntry> describeExecutionPlan() {
        List<ExecutionPlanEntry> plan = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            String name = order.get(i);
            plan.add(new ExecutionPlanEntry(i + 1, name, DependencyGraph.declaredDependencies(tools.get(name))));
        }
        return plan;
    }

    /**
     * Re-checks that every declared dependency is registered.
     *
     * @throws PipelineConstructionException MISSING_DEPENDENCY for the first dangling reference
     */
    public void validateAllDependencies() {
        for (Tool tool : tools.values()) {
            for (String dep : DependencyGraph.declaredDependencies(tool)) {
                if (!tools.containsKey(dep)) {
                    throw PipelineConstructionException.missingDependency(tool.getName(), dep);
                }
            }
        }
    }

    public int getProcessorCount() {
        return tools.size();
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public Optional<Tool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public PipelineRunState getLastRunState() {
        return lastRunState;
    }

    /** Records of the latest run, including the failed tool if the run failed. */
    public List<ToolRunRecord> getLastRunRecords() {
        return List.copyOf(lastRunRecords);
    }

    private void notifyProgress(String toolName, ComponentStatus status, String description) {
        if (progressSink == null) {
            return;
        }
        try {
            progressSink.onToolStatus(toolName, status, description);
        } catch (RuntimeException e) {
            log.warn("Progress sink failed for tool '{}' ({}): {}", toolName, status, e.getMessage());
        }
    }

    private static String requireName(Tool tool) {
        Objects.requireNonNull(tool, "tool");
        String name = tool.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank: " + tool.getClass().getName());
        }
        return name;
    }
}
