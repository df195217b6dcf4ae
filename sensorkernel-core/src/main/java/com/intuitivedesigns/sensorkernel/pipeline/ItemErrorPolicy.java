/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

/**
 * Decides what a stage worker does with an item whose processing failed.
 */
@FunctionalInterface
public interface ItemErrorPolicy {

    enum Decision {
        /** Apply the stage to the same item again. */
        RETRY,
        /** Count the failure and move on to the next item. */
        DROP,
        /** Count the failure and stop this stage's worker. Other stages keep running. */
        ESCALATE
    }

    /**
     * @param stage   failing stage name
     * @param failure the failed result
     * @param attempt 1 for the first try
     */
    Decision onFailure(String stage, StageResult failure, int attempt);

    /**
     * Retries up to {@code maxRetries} times, then drops.
     */
    static ItemErrorPolicy retryThenDrop(int maxRetries) {
        final int limit = Math.max(0, maxRetries);
        return (stage, failure, attempt) -> attempt <= limit ? Decision.RETRY : Decision.DROP;
    }

    static ItemErrorPolicy escalate() {
        return (stage, failure, attempt) -> Decision.ESCALATE;
    }
}
