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

package dev.mars.flowlift.core;

import java.util.Objects;

/**
 * A directed link from an origin node's output anchor to a destination node's
 * input anchor. Several connections may share an origin, a destination, or both.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-05
 */
public final class Connection {

    public static final String DEFAULT_OUTPUT_ANCHOR = "Output";
    public static final String DEFAULT_INPUT_ANCHOR = "Input";

    private final int originId;
    private final String originAnchor;
    private final int destinationId;
    private final String destinationAnchor;
    private final boolean wireless;

    public Connection(int originId, String originAnchor, int destinationId, String destinationAnchor) {
        this(originId, originAnchor, destinationId, destinationAnchor, false);
    }

    public Connection(int originId, String originAnchor, int destinationId, String destinationAnchor,
                      boolean wireless) {
        this.originId = originId;
        this.originAnchor = originAnchor != null ? originAnchor : DEFAULT_OUTPUT_ANCHOR;
        this.destinationId = destinationId;
        this.destinationAnchor = destinationAnchor != null ? destinationAnchor : DEFAULT_INPUT_ANCHOR;
        this.wireless = wireless;
    }

    public int getOriginId() {
        return originId;
    }

    public String getOriginAnchor() {
        return originAnchor;
    }

    public int getDestinationId() {
        return destinationId;
    }

    public String getDestinationAnchor() {
        return destinationAnchor;
    }

    public boolean isWireless() {
        return wireless;
    }

    public boolean isSelfLoop() {
        return originId == destinationId;
    }

    public Connection withOrigin(int newOriginId, String newOriginAnchor) {
        return new Connection(newOriginId, newOriginAnchor, destinationId, destinationAnchor, wireless);
    }

    public Connection withDestination(int newDestinationId, String newDestinationAnchor) {
        return new Connection(originId, originAnchor, newDestinationId, newDestinationAnchor, wireless);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return originId == that.originId &&
               destinationId == that.destinationId &&
               wireless == that.wireless &&
               originAnchor.equals(that.originAnchor) &&
               destinationAnchor.equals(that.destinationAnchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originId, originAnchor, destinationId, destinationAnchor, wireless);
    }

    @Override
    public String toString() {
        return originId + "." + originAnchor + " -> " + destinationId + "." + destinationAnchor;
    }
}
