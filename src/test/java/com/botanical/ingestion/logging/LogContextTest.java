package com.botanical.ingestion.logging;

import com.botanical.ingestion.core.model.Provider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forProviderRequest sets correlationId, provider, endpoint and operation")
    void forProviderRequest() {
        try (LogContext ctx = LogContext.forProviderRequest("corr-1", Provider.TREFLE, "/plants/search")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("trefle", MDC.get("provider"));
            assertEquals("/plants/search", MDC.get("endpoint"));
            assertEquals("provider-request", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forIngest sets the provider and scientific name")
    void forIngest() {
        try (LogContext ctx = LogContext.forIngest("corr-2", Provider.PERENUAL, "Panax ginseng")) {
            assertEquals("perenual", MDC.get("provider"));
            assertEquals("Panax ginseng", MDC.get("scientificName"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forReconcile sets the run id")
    void forReconcile() {
        try (LogContext ctx = LogContext.forReconcile("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("reconcile", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close removes only the keys it added")
    void closeRemovesOwnKeys() {
        MDC.put("tenant", "herbs");
        LogContext ctx = LogContext.forReconcile("run-1").with("phase", "merge");
        assertEquals("merge", MDC.get("phase"));

        ctx.close();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("phase"));
        assertEquals("herbs", MDC.get("tenant"));
    }

    @Test
    @DisplayName("Correlation ids are unique")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
