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

package dev.mars.dygram.ast;

import java.util.List;
import java.util.Optional;

/**
 * Anything that owns child nodes and edges: the machine itself and every node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface NodeContainer {

    /**
     * Child nodes in document order. The list is live; structural passes mutate it in place.
     */
    List<Node> getNodes();

    /**
     * Edges declared directly in this container, in document order. Live list.
     */
    List<Edge> getEdges();

    default Optional<Node> findChild(String simpleName) {
        return getNodes().stream().filter(n -> simpleName.equals(n.getName())).findFirst();
    }
}
