package com.expansion.leads.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("20260101T060000Z")) {
            assertEquals("20260101T060000Z", MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("forLead should set leadKey and source in MDC")
    void forLeadSetsMDC() {
        try (LogContext ctx = LogContext.forLead("12345678", "SPONSOR_REGISTER")) {
            assertEquals("12345678", MDC.get("leadKey"));
            assertEquals("SPONSOR_REGISTER", MDC.get("source"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forLead("12345678", "COMPANIES_HOUSE");
        assertNotNull(MDC.get("leadKey"));

        ctx.close();

        assertNull(MDC.get("leadKey"));
        assertNull(MDC.get("source"));
    }

    @Test
    @DisplayName("Nested stage context leaves the outer run context in place")
    void nestedContextKeepsOuterKeys() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext stage = LogContext.forStage("enrich")) {
                assertEquals("run-1", MDC.get("runId"));
                assertEquals("enrich", MDC.get("stage"));
            }
            assertEquals("run-1", MDC.get("runId"));
            assertNull(MDC.get("stage"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("with() should add custom keys that are removed on close")
    void withAddsCustomKey() {
        try (LogContext ctx = LogContext.forStage("sponsor").with("rowKey", "SPONSOR::ACME")) {
            assertEquals("SPONSOR::ACME", MDC.get("rowKey"));
        }
        assertNull(MDC.get("rowKey"));
    }

    @Test
    @DisplayName("An inner lead context restores the outer lead key on close")
    void innerContextRestoresShadowedKey() {
        try (LogContext outer = LogContext.forLead("NAME::acme::london", "SPONSOR_REGISTER")) {
            try (LogContext inner = LogContext.forLead("12345678", "COMPANIES_HOUSE")) {
                assertEquals("12345678", MDC.get("leadKey"));
            }
            assertEquals("NAME::acme::london", MDC.get("leadKey"));
            assertEquals("SPONSOR_REGISTER", MDC.get("source"));
        }
        assertNull(MDC.get("leadKey"));
    }
}
