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

import java.util.List;

/**
 * Thrown when edge references remain unresolved after linking a machine in strict mode.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class UnresolvedReferenceException extends DygramException {

    private final String machineTitle;
    private final List<String> references;

    public UnresolvedReferenceException(String machineTitle, List<String> references) {
        super("Could not resolve reference(s): " + String.join(", ", references));
        this.machineTitle = machineTitle;
        this.references = List.copyOf(references);
    }

    public String getMachineTitle() {
        return machineTitle;
    }

    public List<String> getReferences() {
        return references;
    }

    @Override
    public String getMessage() {
        if (machineTitle == null) {
            return super.getMessage();
        }
        return "Machine '" + machineTitle + "': " + super.getMessage();
    }
}
