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

package dev.mars.dygram.semantic.link;

import dev.mars.dygram.core.exceptions.UnresolvedReferenceException;

import java.util.List;

/**
 * Outcome of linking one machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class LinkResult {

    private final String machineTitle;
    private final int resolvedCount;
    private final List<String> createdPlaceholders;
    private final List<String> unresolvedReferences;

    public LinkResult(String machineTitle, int resolvedCount, List<String> createdPlaceholders,
                      List<String> unresolvedReferences) {
        this.machineTitle = machineTitle;
        this.resolvedCount = resolvedCount;
        this.createdPlaceholders = List.copyOf(createdPlaceholders);
        this.unresolvedReferences = List.copyOf(unresolvedReferences);
    }

    public int getResolvedCount() {
        return resolvedCount;
    }

    /**
     * Qualified names of the placeholder nodes added to the tree.
     */
    public List<String> getCreatedPlaceholders() {
        return createdPlaceholders;
    }

    /**
     * Reference texts left unresolved. Only non-empty in strict mode.
     */
    public List<String> getUnresolvedReferences() {
        return unresolvedReferences;
    }

    public boolean isFullyResolved() {
        return unresolvedReferences.isEmpty();
    }

    public void throwIfUnresolved() throws UnresolvedReferenceException {
        if (!unresolvedReferences.isEmpty()) {
            throw new UnresolvedReferenceException(machineTitle, unresolvedReferences);
        }
    }

    @Override
    public String toString() {
        return "LinkResult{" +
                "resolved=" + resolvedCount +
                ", placeholders=" + createdPlaceholders.size() +
                ", unresolved=" + unresolvedReferences +
                '}';
    }
}
