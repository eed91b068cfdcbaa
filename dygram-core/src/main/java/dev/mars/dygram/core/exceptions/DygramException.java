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
 * Base exception class for all DyGram-related exceptions.
 * Provides a common hierarchy for error handling throughout the semantic passes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class DygramException extends Exception {

    public DygramException(String message) {
        super(message);
    }

    public DygramException(String message, Throwable cause) {
        super(message, cause);
    }

    public DygramException(Throwable cause) {
        super(cause);
    }
}
