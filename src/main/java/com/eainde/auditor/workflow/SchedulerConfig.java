package com.eainde.auditor.workflow;

import java.time.Duration;

/**
 * Immutable execution limits handed to the scheduler and engine at construction.
 *
 * @param workerPoolSize       threads available to a fan-out group
 * @param nodeTimeout          budget for a single node, measured from when it starts running
 * @param runTimeout           budget for the whole run
 * @param maxStageTransitions  stop after this many stage transitions, guarding against router cycles
 */
public record SchedulerConfig(int workerPoolSize, Duration nodeTimeout, Duration runTimeout, int maxStageTransitions) {

    public static final SchedulerConfig DEFAULT =
            new SchedulerConfig(4, Duration.ofMinutes(5), Duration.ofMinutes(30), 25);

    public SchedulerConfig {
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be at least 1");
        }
        if (nodeTimeout == null || nodeTimeout.isNegative() || nodeTimeout.isZero()) {
            throw new IllegalArgumentException("nodeTimeout must be positive");
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalArgumentException("runTimeout must be positive");
        }
        if (maxStageTransitions < 1) {
            throw new IllegalArgumentException("maxStageTransitions must be at least 1");
        }
    }
}
