package com.txlens.pipeline.progress;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Tracks component progress for one analysis and forwards every change as a {@link ProgressEvent}.
 * Used as the pipeline's {@link ProgressSink} and directly by the analyzer for steps outside the pipeline.
 * Once a terminal event (complete or error) is sent, further updates are dropped.
 */
@Slf4j
public class ProgressTracker implements ProgressSink {

    private final Consumer<ProgressEvent> listener;
    private final Clock clock;
    private final Map<String, ComponentUpdate> components = new LinkedHashMap<>();
    private final Map<String, Instant> startTimes = new HashMap<>();
    private boolean closed;

    public ProgressTracker(Consumer<ProgressEvent> listener) {
        this(listener, Clock.systemUTC());
    }

    public ProgressTracker(Consumer<ProgressEvent> listener, Clock clock) {
        this.listener = listener;
        this.clock = clock;
    }

    @Override
    public void onToolStatus(String toolName, ComponentStatus status, String description) {
        updateComponent(toolName, ToolCatalog.groupOf(toolName), ToolCatalog.titleOf(toolName), status, description);
    }

    public synchronized void updateComponent(String id, ComponentGroup group, String title,
                                             ComponentStatus status, String description) {
        if (closed) {
            return;
        }
        Instant now = clock.instant();
        Instant startTime = startTimes.putIfAbsent(id, now);
        long durationMs = 0;
        if (startTime == null) {
            startTime = now;
        } else {
            durationMs = Duration.between(startTime, now).toMillis();
            // a component that already started never reports zero
            if (durationMs == 0 && status != ComponentStatus.INITIATED) {
                durationMs = 1;
            }
        }
        ComponentUpdate update = new ComponentUpdate(id, group, title, status, description, now, startTime, durationMs);
        components.put(id, update);
        publish(ProgressEvent.componentUpdate(update));
    }

    public synchronized List<ComponentUpdate> getAllComponents() {
        return new ArrayList<>(components.values());
    }

    public synchronized void sendComplete(Object result) {
        if (closed) {
            return;
        }
        publish(ProgressEvent.complete(result));
        closed = true;
    }

    public synchronized void sendError(Throwable error) {
        if (closed) {
            return;
        }
        publish(ProgressEvent.error(error.getMessage()));
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void publish(ProgressEvent event) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener rejected {} event: {}", event.type(), e.getMessage());
        }
    }
}
