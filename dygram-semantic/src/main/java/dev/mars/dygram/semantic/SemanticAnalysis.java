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

package dev.mars.dygram.semantic;

import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.semantic.dependency.InferredDependency;
import dev.mars.dygram.semantic.expand.QualifiedNameExpander.ExpansionResult;
import dev.mars.dygram.semantic.graph.GraphStatistics;
import dev.mars.dygram.semantic.graph.GraphValidationResult;
import dev.mars.dygram.semantic.link.LinkResult;
import dev.mars.dygram.validation.ValidationContext;

import java.util.List;
import java.util.Objects;

/**
 * Everything one run of {@link SemanticPipeline} produced for a machine: the expanded and linked
 * tree, the diagnostics, the graph analysis and the inferred dependencies.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class SemanticAnalysis {

    private final Machine machine;
    private final ValidationContext context;
    private final ExpansionResult expansion;
    private final LinkResult linkResult;
    private final GraphValidationResult graphResult;
    private final GraphStatistics statistics;
    private final List<InferredDependency> dependencies;

    SemanticAnalysis(Machine machine, ValidationContext context, ExpansionResult expansion, LinkResult linkResult,
                     GraphValidationResult graphResult, GraphStatistics statistics,
                     List<InferredDependency> dependencies) {
        this.machine = Objects.requireNonNull(machine, "Machine cannot be null");
        this.context = Objects.requireNonNull(context, "Validation context cannot be null");
        this.expansion = Objects.requireNonNull(expansion, "Expansion result cannot be null");
        this.linkResult = Objects.requireNonNull(linkResult, "Link result cannot be null");
        this.graphResult = Objects.requireNonNull(graphResult, "Graph result cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "Graph statistics cannot be null");
        this.dependencies = List.copyOf(dependencies);
    }

    public Machine getMachine() {
        return machine;
    }

    public ValidationContext getContext() {
        return context;
    }

    public ExpansionResult getExpansion() {
        return expansion;
    }

    public LinkResult getLinkResult() {
        return linkResult;
    }

    public GraphValidationResult getGraphResult() {
        return graphResult;
    }

    public GraphStatistics getStatistics() {
        return statistics;
    }

    public List<InferredDependency> getDependencies() {
        return dependencies;
    }

    /**
     * True when no ERROR diagnostic was recorded. Warnings do not count; whether a machine with
     * warnings may run is up to the executor.
     */
    public boolean isClean() {
        return !context.hasCriticalErrors();
    }

    @Override
    public String toString() {
        return "SemanticAnalysis{" +
                "machine='" + machine.getTitle() + '\'' +
                ", diagnostics=" + context.getErrorCount() +
                ", graphValid=" + graphResult.isValid() +
                ", dependencies=" + dependencies.size() +
                '}';
    }
}
