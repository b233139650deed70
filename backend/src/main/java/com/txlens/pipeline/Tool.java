package com.txlens.pipeline;

import java.util.List;

/**
 * A pluggable analysis step of the {@link BaggagePipeline}.
 * <p>
 * A tool declares by name which other tools must complete before it may start, does its work in
 * {@link #process} by reading upstream keys from the {@link Baggage} and writing its own documented
 * output key(s), and renders its stored output for downstream consumers through the two export hooks.
 * Tools are built once at wiring time and keep no per-run state; configuration comes in through the
 * constructor.
 */
public interface Tool {

    /**
     * Stable unique name. Used as the graph node key, as the progress component id and in error messages.
     */
    String getName();

    /**
     * Human-readable description. Documentation only.
     */
    String getDescription();

    /**
     * Names of tools that must finish successfully before this one starts. Empty when the tool only
     * needs the initial baggage.
     */
    List<String> getDependencies();

    /**
     * Does the unit of work for one run. Called at most once per run.
     *
     * @param context cancellation signal for the run; blocking calls should observe it
     * @param baggage shared state of the run
     * @throws RuntimeException any failure; the pipeline treats it as fatal for the whole run
     */
    void process(ToolContext context, Baggage baggage);

    /**
     * Renders this tool's stored output as a prompt section. Read-only; returns an empty string when the
     * data it needs is absent and never throws.
     */
    default String getPromptContext(ToolContext context, Baggage baggage) {
        return "";
    }

    /**
     * Renders this tool's stored output as retrieval fragments. Read-only; returns an empty set when the
     * data it needs is absent and never throws.
     */
    default RagContext getRagContext(ToolContext context, Baggage baggage) {
        return RagContext.empty();
    }
}
