package com.txlens.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run cancellation signal handed to every tool invocation. A run is cancelled either explicitly via
 * {@link #cancel()} or when its optional deadline passes. The pipeline checks it before each tool; tools
 * check it between their own blocking calls and bound those calls with {@link #boundedTimeout(Duration)}.
 */
public final class ToolContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private final Clock clock;

    private ToolContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /** Context without deadline; only {@link #cancel()} stops it. */
    public static ToolContext create() {
        return new ToolContext(null, Clock.systemUTC());
    }

    public static ToolContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static ToolContext withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive");
        }
        return new ToolContext(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * @throws CancellationException when the run was cancelled or its deadline passed
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Pipeline run cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new CancellationException("Pipeline run deadline exceeded");
        }
    }

    /** Time left before the deadline; empty when the context has none. */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * The smaller of the requested timeout and the time left before the deadline.
     */
    public Duration boundedTimeout(Duration requested) {
        return remaining()
                .filter(left -> left.compareTo(requested) < 0)
                .orElse(requested);
    }
}
