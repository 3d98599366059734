package com.drugbox.recognition.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should populate MDC for a region and clear it on close")
    void testRegionContext() {
        try (LogContext ctx = LogContext.forRegion("scan-1", "scan-1-r0")) {
            assertEquals("scan-1", MDC.get("scanId"));
            assertEquals("scan-1-r0", MDC.get("regionId"));
            assertEquals("region", MDC.get("operation"));
        }
        assertNull(MDC.get("scanId"));
        assertNull(MDC.get("regionId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Should remove extra keys and leave unrelated ones")
    void testWith() {
        MDC.put("requestId", "req-9");
        try (LogContext ctx = LogContext.forScan("scan-1", "CAMERA").with("sessionId", "s-1")) {
            assertEquals("s-1", MDC.get("sessionId"));
            assertEquals("CAMERA", MDC.get("source"));
        }
        assertNull(MDC.get("sessionId"));
        assertEquals("req-9", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Should generate distinct ids")
    void testGenerateId() {
        assertNotEquals(LogContext.generateId(), LogContext.generateId());
        try (LogContext ctx = LogContext.forOptimize("op-1")) {
            assertEquals("optimize", MDC.get("operation"));
        }
    }
}
