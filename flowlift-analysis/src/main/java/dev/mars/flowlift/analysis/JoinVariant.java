/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowlift.analysis;

import java.util.Locale;
import java.util.Set;

/**
 * Relational shape of a Join tool. Alteryx has no join type setting as such; the
 * variant follows from which of the Join (J), Left (L) and Right (R) output
 * anchors are wired downstream.
 */
public enum JoinVariant {
    INNER,
    LEFT_OUTER,
    RIGHT_OUTER,
    FULL_OUTER,
    /** Left rows without a match. */
    LEFT_ANTI,
    /** Right rows without a match. */
    RIGHT_ANTI,
    /** Unmatched rows of both sides. */
    FULL_ANTI;

    /**
     * Variant from a configured join type, or {@code null} when the value names no known type.
     */
    public static JoinVariant fromConfigured(String joinType) {
        if (joinType == null) {
            return null;
        }
        switch (joinType.trim().toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "")) {
            case "inner":
                return INNER;
            case "left":
            case "leftouter":
                return LEFT_OUTER;
            case "right":
            case "rightouter":
                return RIGHT_OUTER;
            case "full":
            case "outer":
            case "fullouter":
                return FULL_OUTER;
            default:
                return null;
        }
    }

    /**
     * Variant from the output anchors in use. No recognizable anchor means INNER.
     */
    public static JoinVariant fromAnchors(Set<String> anchors) {
        boolean join = false;
        boolean left = false;
        boolean right = false;
        for (String anchor : anchors) {
            switch (anchor.trim().toUpperCase(Locale.ROOT)) {
                case "J":
                case "JOIN":
                    join = true;
                    break;
                case "L":
                case "LEFT":
                    left = true;
                    break;
                case "R":
                case "RIGHT":
                    right = true;
                    break;
                default:
                    break;
            }
        }
        if (join) {
            if (left && right) {
                return FULL_OUTER;
            }
            return left ? LEFT_OUTER : right ? RIGHT_OUTER : INNER;
        }
        if (left && right) {
            return FULL_ANTI;
        }
        if (left) {
            return LEFT_ANTI;
        }
        return right ? RIGHT_ANTI : INNER;
    }
}
