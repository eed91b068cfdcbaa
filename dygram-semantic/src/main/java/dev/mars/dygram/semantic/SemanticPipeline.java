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

import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeContainer;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.config.DygramConfiguration;
import dev.mars.dygram.core.exceptions.MachineStructureException;
import dev.mars.dygram.semantic.dependency.DependencyAnalyzer;
import dev.mars.dygram.semantic.dependency.InferredDependency;
import dev.mars.dygram.semantic.expand.QualifiedNameExpander;
import dev.mars.dygram.semantic.expand.QualifiedNameExpander.ExpansionResult;
import dev.mars.dygram.semantic.graph.GraphStatistics;
import dev.mars.dygram.semantic.graph.GraphValidationResult;
import dev.mars.dygram.semantic.graph.GraphValidator;
import dev.mars.dygram.semantic.link.LinkResult;
import dev.mars.dygram.semantic.link.MachineLinker;
import dev.mars.dygram.semantic.nodes.NodeTypeChecker;
import dev.mars.dygram.semantic.types.TypeChecker;
import dev.mars.dygram.validation.ErrorBehaviorConfig;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the semantic passes over a machine in order.
 *
 * <ol>
 *   <li>structure check: blank node names and edges without endpoints are rejected</li>
 *   <li>qualified name expansion</li>
 *   <li>linking, with placeholder creation unless the machine is strict</li>
 *   <li>attribute type checks and template reference checks</li>
 *   <li>graph validation</li>
 *   <li>dependency inference</li>
 * </ol>
 *
 * <p>The first three steps rewrite the machine in place; the rest only read it and report into
 * the analysis' {@link ValidationContext}. A pipeline holds no per-machine state and may be
 * shared between threads analyzing different machines.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class SemanticPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SemanticPipeline.class);

    private final DygramConfiguration configuration;
    private final QualifiedNameExpander expander;
    private final MachineLinker linker;

    public SemanticPipeline() {
        this(DygramConfiguration.defaults());
    }

    public SemanticPipeline(DygramConfiguration configuration) {
        this(configuration, new QualifiedNameExpander(), new MachineLinker());
    }

    public SemanticPipeline(DygramConfiguration configuration, QualifiedNameExpander expander, MachineLinker linker) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.expander = Objects.requireNonNull(expander, "Expander cannot be null");
        this.linker = Objects.requireNonNull(linker, "Linker cannot be null");
    }

    public SemanticAnalysis analyze(Machine machine) throws MachineStructureException {
        Objects.requireNonNull(machine, "Machine cannot be null");
        ValidationContext context = new ValidationContext(ErrorBehaviorConfig.builder()
                .maxErrors(configuration.getMaxErrors())
                .failFast(configuration.isFailFast())
                .build());
        return analyze(machine, context);
    }

    public SemanticAnalysis analyze(Machine machine, ValidationContext context) throws MachineStructureException {
        Objects.requireNonNull(machine, "Machine cannot be null");
        Objects.requireNonNull(context, "Validation context cannot be null");
        boolean strict = machine.isStrictMode() || configuration.isStrictByDefault();
        logger.info("Analyzing machine '{}' (strict={})", machine.getTitle(), strict);

        checkStructure(machine);

        ExpansionResult expansion = expander.expand(machine, context, strict);
        LinkResult linkResult = linker.link(machine, context, strict);

        TypeChecker typeChecker = new TypeChecker(machine);
        typeChecker.validateAllAttributesWithContext(context);
        typeChecker.validateTemplateReferencesWithContext(context);

        GraphValidator graphValidator = new GraphValidator(machine);
        GraphValidationResult graphResult = graphValidator.validateWithContext(context, configuration.isReportCycles());
        GraphStatistics statistics = graphValidator.getStatistics();

        List<InferredDependency> dependencies = new DependencyAnalyzer(machine, configuration).inferDependencies();
        tagFlaggedNodes(machine, context);

        SemanticAnalysis analysis = new SemanticAnalysis(machine, context, expansion, linkResult,
                graphResult, statistics, dependencies);
        logger.info("Finished analysis of '{}': {} diagnostic(s), {} error(s)",
                machine.getTitle(), context.getErrorCount(), context.getCount(ValidationSeverity.ERROR));
        return analysis;
    }

    private static void tagFlaggedNodes(Machine machine, ValidationContext context) {
        Map<String, Node> byDisplayName = new HashMap<>();
        NodeWalker.displayNames(machine).forEach((node, name) -> byDisplayName.put(name, node));
        context.getAllNodeFlags().forEach((name, flag) -> {
            Node node = byDisplayName.get(name);
            if (node != null) {
                NodeTypeChecker.getNodeType(node).ifPresent(flag::setNodeType);
            }
        });
    }

    private static void checkStructure(Machine machine) throws MachineStructureException {
        checkContainer(machine, machine.getTitle());
    }

    private static void checkContainer(NodeContainer container, String where) throws MachineStructureException {
        for (Node node : container.getNodes()) {
            if (node.getName().isBlank()) {
                throw new MachineStructureException("Node with a blank name in '" + where + "'");
            }
            checkContainer(node, node.getName());
        }
        for (Edge edge : container.getEdges()) {
            if (edge.getSources().isEmpty()) {
                throw new MachineStructureException("Edge without a source in '" + where + "': " + edge);
            }
            if (edge.getSegments().isEmpty()) {
                throw new MachineStructureException("Edge without a target in '" + where + "': " + edge);
            }
            for (EdgeSegment segment : edge.getSegments()) {
                if (segment.getTargets().isEmpty()) {
                    throw new MachineStructureException("Edge segment without a target in '" + where + "': " + edge);
                }
            }
            if (edge.allReferences().map(Reference::getText).anyMatch(String::isBlank)) {
                throw new MachineStructureException("Edge with a blank reference in '" + where + "': " + edge);
            }
        }
    }
}
