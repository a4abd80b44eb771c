package com.landdev.cashflow.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdServiceTest {

    private CorrelationIdService correlationIdService;

    @BeforeEach
    void setUp() {
        correlationIdService = new CorrelationIdService();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testGenerateAndClear() {
        String id = correlationIdService.generateCorrelationId();

        assertEquals(id, correlationIdService.getCurrentCorrelationId());
        correlationIdService.clear();
        assertNull(correlationIdService.getCurrentCorrelationId());
    }

    @Test
    void testBlankIdIgnored() {
        correlationIdService.setCorrelationId("abc");
        correlationIdService.setCorrelationId("");

        assertEquals("abc", correlationIdService.getCurrentCorrelationId());
    }

    @Test
    void testContextPropagatedToOtherThread() throws Exception {
        correlationIdService.setCorrelationId("req-42");

        String seen = CompletableFuture.supplyAsync(
                correlationIdService.withCurrentContext(correlationIdService::getCurrentCorrelationId)).get();

        assertEquals("req-42", seen);
    }
}
