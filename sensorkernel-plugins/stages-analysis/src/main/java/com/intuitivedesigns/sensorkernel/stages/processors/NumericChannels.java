/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.processors;

import java.util.OptionalDouble;
import java.util.Set;

final class NumericChannels {

    private NumericChannels() {}

    /**
     * @param configured explicit channel names, or empty for every channel
     */
    static boolean selected(Set<String> configured, String channel) {
        return configured.isEmpty() || configured.contains(channel);
    }

    static OptionalDouble asDouble(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }
}
