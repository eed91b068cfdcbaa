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

package dev.mars.dygram.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shared accumulator for the diagnostics of one analysis run.
 *
 * <p>Every pass records into the same context instead of throwing. Diagnostics that
 * name a node are also collected on that node's {@link NodeErrorFlag}, which tracks
 * whether the node is blocked and which recovery the executor should apply.</p>
 *
 * <p>A context belongs to a single run and is not thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class ValidationContext {

    private static final Logger logger = LoggerFactory.getLogger(ValidationContext.class);

    private final List<ValidationError> errors = new ArrayList<>();
    private final Map<String, NodeErrorFlag> nodeFlags = new LinkedHashMap<>();
    private final ErrorBehaviorConfig behavior;
    private final Clock clock;
    private int droppedCount;

    public ValidationContext() {
        this(ErrorBehaviorConfig.defaults());
    }

    public ValidationContext(ErrorBehaviorConfig behavior) {
        this(behavior, Clock.systemUTC());
    }

    public ValidationContext(ErrorBehaviorConfig behavior, Clock clock) {
        this.behavior = Objects.requireNonNull(behavior, "Error behavior cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Records a diagnostic, stamping its timestamp and updating the node flag when the
     * location names a node.
     *
     * In fail-fast mode nothing is recorded after the first ERROR.
     *
     * @return false if the diagnostic was dropped because the error limit was reached or
     *         fail-fast collection already stopped
     */
    public boolean addError(ValidationError error) {
        Objects.requireNonNull(error, "Validation error cannot be null");

        if (behavior.isFailFast() && hasCriticalErrors()) {
            if (droppedCount++ == 0) {
                logger.warn("Fail-fast: first error already recorded, further diagnostics are dropped");
            }
            return false;
        }

        int limit = behavior.getMaxErrors();
        if (limit > 0 && errors.size() >= limit) {
            if (droppedCount++ == 0) {
                logger.warn("Diagnostic limit of {} reached, further diagnostics are dropped", limit);
            }
            return false;
        }

        ValidationError stamped = error.withTimestamp(clock.instant());
        errors.add(stamped);
        stamped.getNodeName().ifPresent(node -> flagFor(node).addError(stamped));

        logger.debug("Recorded {}", stamped);
        return true;
    }

    public void addErrors(Collection<ValidationError> toAdd) {
        toAdd.forEach(this::addError);
    }

    public void setRecoveryAction(String nodeName, RecoveryAction action) {
        Objects.requireNonNull(action, "Recovery action cannot be null");
        flagFor(nodeName).setRecoveryAction(action);
    }

    public Optional<RecoveryAction> getRecoveryAction(String nodeName) {
        NodeErrorFlag flag = nodeFlags.get(nodeName);
        return flag == null ? Optional.empty() : flag.getRecoveryAction();
    }

    /**
     * Recovery to apply for a node: the explicit action if one was attached, otherwise the
     * configured node strategy, then the category strategy of the node's first diagnostic,
     * then the default strategy.
     */
    public RecoveryAction resolveRecoveryAction(String nodeName) {
        Optional<RecoveryAction> explicit = getRecoveryAction(nodeName);
        if (explicit.isPresent()) {
            return explicit.get();
        }

        RecoveryStrategy nodeStrategy = behavior.getNodeStrategy(nodeName);
        if (nodeStrategy != null) {
            return RecoveryAction.of(nodeStrategy);
        }

        List<ValidationError> nodeErrors = getNodeErrors(nodeName);
        if (!nodeErrors.isEmpty()) {
            RecoveryStrategy categoryStrategy = behavior.getCategoryStrategy(nodeErrors.get(0).getCategory());
            if (categoryStrategy != null) {
                return RecoveryAction.of(categoryStrategy);
            }
        }
        return RecoveryAction.of(behavior.getDefaultStrategy());
    }

    public List<ValidationError> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationError> getErrorsBySeverity(ValidationSeverity severity) {
        return errors.stream().filter(e -> e.getSeverity() == severity).collect(Collectors.toList());
    }

    public List<ValidationError> getErrorsByCategory(ValidationCategory category) {
        return errors.stream().filter(e -> e.getCategory() == category).collect(Collectors.toList());
    }

    public List<ValidationError> getErrorsByCode(String code) {
        return errors.stream().filter(e -> e.getCode().equals(code)).collect(Collectors.toList());
    }

    public List<ValidationError> getNodeErrors(String nodeName) {
        NodeErrorFlag flag = nodeFlags.get(nodeName);
        return flag == null ? List.of() : flag.getErrors();
    }

    public Optional<NodeErrorFlag> getNodeFlag(String nodeName) {
        return Optional.ofNullable(nodeFlags.get(nodeName));
    }

    public Map<String, NodeErrorFlag> getAllNodeFlags() {
        return Collections.unmodifiableMap(nodeFlags);
    }

    public boolean isNodeBlocked(String nodeName) {
        NodeErrorFlag flag = nodeFlags.get(nodeName);
        return flag != null && flag.isBlocked();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * True if any recorded diagnostic has ERROR severity.
     */
    public boolean hasCriticalErrors() {
        return errors.stream().anyMatch(ValidationError::isError);
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getCount(ValidationSeverity severity) {
        return (int) errors.stream().filter(e -> e.getSeverity() == severity).count();
    }

    public int getDroppedCount() {
        return droppedCount;
    }

    public ErrorBehaviorConfig getBehavior() {
        return behavior;
    }

    public void clear() {
        errors.clear();
        nodeFlags.clear();
        droppedCount = 0;
    }

    public ValidationSummary getSummary() {
        Map<ValidationSeverity, Integer> bySeverity = new EnumMap<>(ValidationSeverity.class);
        for (ValidationSeverity severity : ValidationSeverity.values()) {
            bySeverity.put(severity, getCount(severity));
        }

        Map<ValidationCategory, Integer> byCategory = new EnumMap<>(ValidationCategory.class);
        for (ValidationError error : errors) {
            byCategory.merge(error.getCategory(), 1, Integer::sum);
        }

        List<String> blocked = nodeFlags.values().stream()
                .filter(NodeErrorFlag::isBlocked)
                .map(NodeErrorFlag::getNodeName)
                .collect(Collectors.toList());

        return new ValidationSummary(errors.size(), bySeverity, byCategory, blocked);
    }

    private NodeErrorFlag flagFor(String nodeName) {
        return nodeFlags.computeIfAbsent(nodeName, NodeErrorFlag::new);
    }

    @Override
    public String toString() {
        return "ValidationContext{" +
                "errors=" + errors.size() +
                ", flaggedNodes=" + nodeFlags.size() +
                ", critical=" + hasCriticalErrors() +
                '}';
    }
}
