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

package dev.mars.dygram.semantic.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural findings for the control graph of a machine.
 *
 * <p>{@link #isValid()} is true when every node is reachable, no node is orphaned and there is
 * at least one entry point. Warnings are advisory and never affect validity.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class GraphValidationResult {

    private final List<String> entryPoints;
    private final List<String> exitPoints;
    private final List<String> unreachableNodes;
    private final List<String> orphanedNodes;
    private final List<List<String>> cycles;
    private final List<String> warnings;

    public GraphValidationResult(List<String> entryPoints, List<String> exitPoints, List<String> unreachableNodes,
                                 List<String> orphanedNodes, List<List<String>> cycles, List<String> warnings) {
        this.entryPoints = List.copyOf(entryPoints);
        this.exitPoints = List.copyOf(exitPoints);
        this.unreachableNodes = List.copyOf(unreachableNodes);
        this.orphanedNodes = List.copyOf(orphanedNodes);
        this.cycles = cycles.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return unreachableNodes.isEmpty() && orphanedNodes.isEmpty() && !entryPoints.isEmpty();
    }

    public List<String> getEntryPoints() {
        return entryPoints;
    }

    public List<String> getExitPoints() {
        return exitPoints;
    }

    public List<String> getUnreachableNodes() {
        return unreachableNodes;
    }

    public List<String> getOrphanedNodes() {
        return orphanedNodes;
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public boolean isMissingEntryPoints() {
        return entryPoints.isEmpty();
    }

    public boolean isMissingExitPoints() {
        return exitPoints.isEmpty();
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "GraphValidationResult{" +
                "valid=" + isValid() +
                ", entries=" + entryPoints +
                ", exits=" + exitPoints +
                ", unreachable=" + unreachableNodes +
                ", orphaned=" + orphanedNodes +
                ", cycles=" + cycles.size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
