package com.landdev.cashflow.api.filter;

import com.landdev.cashflow.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private CorrelationIdFilter filter;

    @BeforeEach
    void setUp() {
        filter = new CorrelationIdFilter(new CorrelationIdService());
    }

    @Test
    void testIncomingIdPropagated() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/projects/1/cash-flow");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get("correlationId"));

        filter.doFilter(request, response, chain);

        assertEquals("req-7", seen.get());
        assertEquals("req-7", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    void testIdGeneratedWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health/liveness");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertNotNull(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get("correlationId"));
    }
}
