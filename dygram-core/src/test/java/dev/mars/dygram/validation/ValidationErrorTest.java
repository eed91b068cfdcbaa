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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for ValidationErrorTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class ValidationErrorTest {

    @Test
    void testBuilderDefaults() {
        ValidationError error = ValidationError.builder().message("broken").build();

        assertEquals(ValidationSeverity.ERROR, error.getSeverity());
        assertEquals(ValidationCategory.STRUCTURAL, error.getCategory());
        assertEquals("VALIDATION_ERROR", error.getCode());
        assertTrue(error.isError());
        assertTrue(error.getLocation().isEmpty());
        assertTrue(error.getNodeName().isEmpty());
        assertTrue(error.getTimestamp().isEmpty());
    }

    @Test
    void testMessageIsRequired() {
        assertThrows(NullPointerException.class, () -> ValidationError.builder().build());
    }

    @Test
    void testPropertyLocation() {
        ValidationError error = ValidationError.builder()
                .severity(ValidationSeverity.WARNING)
                .category(ValidationCategory.TYPE)
                .code(TypeErrorCodes.MISSING_VALUE)
                .message("missing")
                .property("config", "retries")
                .expected("Integer")
                .actual("undefined")
                .build();

        assertFalse(error.isError());
        assertEquals("config", error.getNodeName().orElseThrow());
        assertEquals("retries", error.getLocation().orElseThrow().getProperty().orElseThrow());
        assertEquals("Integer", error.getExpected().orElseThrow());
        assertEquals("undefined", error.getActual().orElseThrow());
    }

    @Test
    void testContextSkipsNullValues() {
        ValidationError error = ValidationError.builder()
                .message("cycle")
                .context("cycleLength", 3)
                .context("ignored", null)
                .build();

        assertEquals(1, error.getContext().size());
        assertEquals(3, error.getContext().get("cycleLength"));
    }

    @Test
    void testWithTimestampAndToBuilder() {
        Instant time = Instant.parse("2025-08-21T00:00:00Z");
        ValidationError original = ValidationError.builder().message("x").node("a").build();

        ValidationError stamped = original.withTimestamp(time);
        assertEquals(time, stamped.getTimestamp().orElseThrow());
        assertTrue(original.getTimestamp().isEmpty());

        ValidationError copy = stamped.toBuilder().suggestion("fix it").build();
        assertEquals("fix it", copy.getSuggestion().orElseThrow());
        assertEquals("a", copy.getNodeName().orElseThrow());
    }

    @Test
    void testSeverityAndCategoryValues() {
        assertEquals("warning", ValidationSeverity.WARNING.getValue());
        assertEquals("graph", ValidationCategory.GRAPH.getValue());
    }
}
