package com.resource.naming.logging;

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
    @DisplayName("forClaim sets correlationId, resourceType, actor and operation")
    void forClaimSetsMDC() {
        try (LogContext ctx = LogContext.forClaim("corr-1", "storage_account", "alice")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("storage_account", MDC.get("resourceType"));
            assertEquals("alice", MDC.get("actor"));
            assertEquals("claim", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    void forReleaseSetsName() {
        try (LogContext ctx = LogContext.forRelease("corr-2", "org-st-wus2-prod", "bob")) {
            assertEquals("org-st-wus2-prod", MDC.get("name"));
            assertEquals("release", MDC.get("operation"));
        }
        assertNull(MDC.get("name"));
    }

    @Test
    void forSyncSetsOperation() {
        try (LogContext ctx = LogContext.forSync("corr-3")) {
            assertEquals("slug-sync", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("null values are not put into the MDC")
    void nullValuesSkipped() {
        try (LogContext ctx = LogContext.forClaim("corr-4", null, "alice")) {
            assertNull(MDC.get("resourceType"));
            assertEquals("alice", MDC.get("actor"));
        }
    }

    @Test
    @DisplayName("close leaves keys it did not add")
    void foreignKeysSurvive() {
        MDC.put("requestId", "r-1");
        LogContext.forSync("corr-5").with("snapshotBytes", "120").close();

        assertEquals("r-1", MDC.get("requestId"));
        assertNull(MDC.get("snapshotBytes"));
    }

    @Test
    void correlationIdsAreUnique() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
