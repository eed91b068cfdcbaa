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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValidationContext: recording, node flags, recovery resolution and summaries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
class ValidationContextTest {

    private static final Instant NOW = Instant.parse("2025-08-21T10:15:30Z");

    private ValidationContext context;

    @BeforeEach
    void setUp() {
        context = new ValidationContext(ErrorBehaviorConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== Recording ==========

    @Test
    void testEmptyContext() {
        assertFalse(context.hasErrors());
        assertFalse(context.hasCriticalErrors());
        assertEquals(0, context.getErrorCount());
        assertTrue(context.getAllNodeFlags().isEmpty());
    }

    @Test
    void testAddErrorStampsTimestamp() {
        assertTrue(context.addError(error(ValidationSeverity.WARNING, "start")));

        ValidationError recorded = context.getErrors().get(0);
        assertEquals(NOW, recorded.getTimestamp().orElseThrow());
    }

    @Test
    void testErrorSeverityBlocksNode() {
        context.addError(error(ValidationSeverity.ERROR, "fetch"));

        assertTrue(context.isNodeBlocked("fetch"));
        assertTrue(context.hasCriticalErrors());
        assertEquals(1, context.getNodeErrors("fetch").size());
    }

    @Test
    void testWarningDoesNotBlockNode() {
        context.addError(error(ValidationSeverity.WARNING, "fetch"));
        context.addError(error(ValidationSeverity.INFO, "fetch"));

        assertFalse(context.isNodeBlocked("fetch"));
        assertFalse(context.hasCriticalErrors());
        assertTrue(context.hasErrors());
        assertEquals(2, context.getNodeFlag("fetch").orElseThrow().getErrors().size());
    }

    @Test
    void testErrorWithoutNodeCreatesNoFlag() {
        context.addError(ValidationError.builder()
                .category(ValidationCategory.GRAPH)
                .code(GraphErrorCodes.MISSING_ENTRY)
                .message("No entry points found in machine")
                .build());

        assertEquals(1, context.getErrorCount());
        assertTrue(context.getAllNodeFlags().isEmpty());
    }

    @Test
    void testMaxErrorsDropsExcessDiagnostics() {
        ValidationContext limited = new ValidationContext(ErrorBehaviorConfig.builder().maxErrors(2).build());

        assertTrue(limited.addError(error(ValidationSeverity.ERROR, "a")));
        assertTrue(limited.addError(error(ValidationSeverity.ERROR, "b")));
        assertFalse(limited.addError(error(ValidationSeverity.ERROR, "c")));
        assertFalse(limited.addError(error(ValidationSeverity.ERROR, "d")));

        assertEquals(2, limited.getErrorCount());
        assertEquals(2, limited.getDroppedCount());
        assertFalse(limited.isNodeBlocked("c"));
    }

    // ========== Filtering ==========

    @Test
    void testFilteredViews() {
        context.addError(error(ValidationSeverity.ERROR, "a"));
        context.addError(ValidationError.builder()
                .severity(ValidationSeverity.WARNING)
                .category(ValidationCategory.GRAPH)
                .code(GraphErrorCodes.ORPHANED_NODE)
                .message("orphaned")
                .node("b")
                .build());

        assertEquals(1, context.getErrorsBySeverity(ValidationSeverity.ERROR).size());
        assertEquals(1, context.getErrorsByCategory(ValidationCategory.GRAPH).size());
        assertEquals(1, context.getErrorsByCode(GraphErrorCodes.ORPHANED_NODE).size());
        assertEquals(0, context.getErrorsByCode(GraphErrorCodes.CYCLE_DETECTED).size());
        assertEquals(1, context.getCount(ValidationSeverity.WARNING));
    }

    @Test
    void testClear() {
        context.addError(error(ValidationSeverity.ERROR, "a"));
        context.setRecoveryAction("a", RecoveryAction.skip());

        context.clear();

        assertFalse(context.hasErrors());
        assertTrue(context.getAllNodeFlags().isEmpty());
        assertTrue(context.getRecoveryAction("a").isEmpty());
    }

    // ========== Recovery ==========

    @Test
    void testExplicitRecoveryActionWins() {
        ValidationContext configured = new ValidationContext(ErrorBehaviorConfig.builder()
                .nodeStrategy("fetch", RecoveryStrategy.ABORT)
                .build());
        configured.setRecoveryAction("fetch", RecoveryAction.retry(3, Duration.ofSeconds(2)));

        RecoveryAction action = configured.resolveRecoveryAction("fetch");
        assertEquals(RecoveryStrategy.RETRY, action.getStrategy());
        assertEquals(3, action.getMaxRetries());
        assertEquals(Duration.ofSeconds(2), action.getRetryDelay().orElseThrow());
    }

    @Test
    void testRecoveryFallsBackThroughNodeCategoryAndDefault() {
        ValidationContext configured = new ValidationContext(ErrorBehaviorConfig.builder()
                .defaultStrategy(RecoveryStrategy.SKIP)
                .nodeStrategy("critical", RecoveryStrategy.ABORT)
                .categoryStrategy(ValidationCategory.TYPE, RecoveryStrategy.DEFAULT)
                .failFast(true)
                .build());
        configured.addError(ValidationError.builder()
                .category(ValidationCategory.TYPE)
                .code(TypeErrorCodes.TYPE_MISMATCH)
                .message("mismatch")
                .property("typed", "retries")
                .build());

        assertEquals(RecoveryStrategy.ABORT, configured.resolveRecoveryAction("critical").getStrategy());
        assertEquals(RecoveryStrategy.DEFAULT, configured.resolveRecoveryAction("typed").getStrategy());
        assertEquals(RecoveryStrategy.SKIP, configured.resolveRecoveryAction("other").getStrategy());
        assertTrue(configured.getBehavior().isFailFast());
    }

    @Test
    void testFailFastStopsCollectingAfterFirstError() {
        ValidationContext failFast = new ValidationContext(ErrorBehaviorConfig.builder().failFast(true).build());

        assertTrue(failFast.addError(error(ValidationSeverity.WARNING, "a")));
        assertTrue(failFast.addError(error(ValidationSeverity.ERROR, "b")));
        assertFalse(failFast.addError(error(ValidationSeverity.ERROR, "c")));
        assertFalse(failFast.addError(error(ValidationSeverity.INFO, "d")));

        assertEquals(2, failFast.getErrors().size());
        assertEquals(2, failFast.getDroppedCount());
        assertTrue(failFast.getNodeFlag("c").isEmpty());
        assertTrue(failFast.isNodeBlocked("b"));
    }

    @Test
    void testRecoveryActionFactories() {
        assertEquals(42, RecoveryAction.withDefault(42).getDefaultValue().orElseThrow());
        assertEquals(RecoveryStrategy.CONTINUE, RecoveryAction.continueExecution().getStrategy());
        assertTrue(RecoveryAction.custom(error -> "handled").getHandler().isPresent());
        assertThrows(IllegalArgumentException.class, () -> RecoveryAction.retry(0, Duration.ZERO));
        assertEquals(RecoveryStrategy.RETRY, RecoveryStrategy.fromValue("retry"));
        assertEquals(RecoveryStrategy.CUSTOM, RecoveryStrategy.fromValue("CUSTOM"));
        assertThrows(IllegalArgumentException.class, () -> RecoveryStrategy.fromValue("ignore"));
    }

    // ========== Summary ==========

    @Test
    void testSummary() {
        context.addError(error(ValidationSeverity.ERROR, "a"));
        context.addError(error(ValidationSeverity.WARNING, "b"));
        context.addError(error(ValidationSeverity.HINT, "b"));

        ValidationSummary summary = context.getSummary();

        assertEquals(3, summary.getTotalErrors());
        assertEquals(1, summary.getErrorCount());
        assertEquals(1, summary.getWarningCount());
        assertEquals(0, summary.getInfoCount());
        assertEquals(1, summary.getHintCount());
        assertEquals(3, summary.getCategoryCount(ValidationCategory.STRUCTURAL));
        assertEquals(List.of("a"), summary.getBlockedNodes());

        String report = summary.formatReport();
        assertTrue(report.contains("3 diagnostic(s)"));
        assertTrue(report.contains("blocked nodes: a"));
    }

    private static ValidationError error(ValidationSeverity severity, String node) {
        return ValidationError.builder()
                .severity(severity)
                .code(StructuralErrorCodes.MALFORMED_NODE)
                .message("problem on " + node)
                .node(node)
                .build();
    }
}
