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

package dev.mars.dygram.core.exceptions;

/**
 * Thrown when a machine tree is malformed beyond what the semantic passes can
 * report as diagnostics, for example a node without a name or an edge without segments.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MachineStructureException extends DygramException {

    public MachineStructureException(String message) {
        super(message);
    }

    public MachineStructureException(String message, Throwable cause) {
        super(message, cause);
    }

    public MachineStructureException(Throwable cause) {
        super(cause);
    }
}
