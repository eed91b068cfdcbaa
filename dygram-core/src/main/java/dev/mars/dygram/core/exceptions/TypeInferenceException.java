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
 * Thrown when a value's type cannot be inferred from its shape. The only such
 * shape is an empty array; callers treat it as compatible with any declared type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class TypeInferenceException extends DygramException {

    public TypeInferenceException(String message) {
        super(message);
    }

    public TypeInferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public TypeInferenceException(Throwable cause) {
        super(cause);
    }
}
