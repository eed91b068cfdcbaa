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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All diagnostics attached to one node, plus the blocked flag and recovery decision
 * an executor consults before running it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class NodeErrorFlag {

    private final String nodeName;
    private String nodeType;
    private final List<ValidationError> errors = new ArrayList<>();
    private boolean blocked;
    private RecoveryAction recoveryAction;

    NodeErrorFlag(String nodeName) {
        this.nodeName = Objects.requireNonNull(nodeName, "Node name cannot be null");
    }

    void addError(ValidationError error) {
        errors.add(error);
        if (error.isError()) {
            blocked = true;
        }
    }

    void setRecoveryAction(RecoveryAction action) {
        this.recoveryAction = action;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Optional<String> getNodeType() {
        return Optional.ofNullable(nodeType);
    }

    public void setNodeType(String nodeType) {
        this.nodeType = nodeType;
    }

    public List<ValidationError> getErrors() {
        return List.copyOf(errors);
    }

    /**
     * True iff at least one attached diagnostic has ERROR severity.
     */
    public boolean isBlocked() {
        return blocked;
    }

    public Optional<RecoveryAction> getRecoveryAction() {
        return Optional.ofNullable(recoveryAction);
    }

    @Override
    public String toString() {
        return "NodeErrorFlag{" +
                "node='" + nodeName + '\'' +
                ", errors=" + errors.size() +
                ", blocked=" + blocked +
                (recoveryAction != null ? ", recovery=" + recoveryAction.getStrategy().getValue() : "") +
                '}';
    }
}
