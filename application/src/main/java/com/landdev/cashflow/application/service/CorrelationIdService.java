package com.landdev.cashflow.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Service for managing correlation IDs in the logging MDC
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    private static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Generate a new correlation ID
     */
    public String generateCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        log.debug("Generated correlation ID: {}", correlationId);
        return correlationId;
    }

    /**
     * Get current correlation ID from MDC
     */
    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    /**
     * Set correlation ID in MDC
     */
    public void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.isEmpty()) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    /**
     * Clear correlation ID from MDC
     */
    public void clear() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    /**
     * Wrap a task so it runs with the caller's MDC on another thread
     */
    public <T> Supplier<T> withCurrentContext(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
