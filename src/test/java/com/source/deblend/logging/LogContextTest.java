package com.source.deblend.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("deblend", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSource should set runId and sourceId in MDC")
    void forSourceSetsMDC() {
        try (LogContext ctx = LogContext.forSource("run-2", 42L)) {
            assertEquals("run-2", MDC.get("runId"));
            assertEquals("42", MDC.get("sourceId"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSource("run-3", 7L);
        assertNotNull(MDC.get("sourceId"));

        ctx.close();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("sourceId"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forRun("run-4").with("image", "visit-903334")) {
            assertEquals("visit-903334", MDC.get("image"));
        }
        assertNull(MDC.get("image"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("generateRunId should return unique UUIDs")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateRunId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("Closing a source context keeps the run id of the enclosing run context")
    void nestedContexts() {
        try (LogContext run = LogContext.forRun("outer")) {
            try (LogContext source = LogContext.forSource("outer", 3L)) {
                assertEquals("3", MDC.get("sourceId"));
            }
            assertNull(MDC.get("sourceId"));
            assertEquals("outer", MDC.get("runId"));
            assertEquals("deblend", MDC.get("operation"));

            try (LogContext source = LogContext.forSource("outer", 4L)) {
                assertEquals("4", MDC.get("sourceId"));
            }
            assertEquals("outer", MDC.get("runId"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("close() restores a value the context overwrote")
    void closeRestoresPreviousValue() {
        MDC.put("runId", "enclosing");
        try (LogContext ctx = LogContext.forRun("inner").with("runId", "inner-again")) {
            assertEquals("inner-again", MDC.get("runId"));
        }
        assertEquals("enclosing", MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }
}
