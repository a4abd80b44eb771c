package com.landdev.cashflow.api.controller;

import com.landdev.cashflow.application.service.ConstructionLoanService;
import com.landdev.cashflow.application.service.ProjectionService;
import com.landdev.cashflow.domain.exception.NotFoundException;
import com.landdev.cashflow.domain.exception.UnsupportedConfigurationException;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.Projection;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * REST controller for cash-flow projections
 */
@RestController
@RequestMapping("/api/projects")
public class ProjectionController {

    private static final Logger log = LoggerFactory.getLogger(ProjectionController.class);

    private final ProjectionService projectionService;
    private final ConstructionLoanService constructionLoanService;

    public ProjectionController(ProjectionService projectionService,
                                ConstructionLoanService constructionLoanService) {
        this.projectionService = projectionService;
        this.constructionLoanService = constructionLoanService;
    }

    @GetMapping("/{projectId}/cash-flow")
    public ResponseEntity<?> getCashFlow(@PathVariable Long projectId,
                                         @RequestParam(required = false) List<Long> containerIds,
                                         @RequestParam(defaultValue = "true") boolean includeFinancing) {
        return handle("project " + projectId, () -> {
            try {
                return projectionService.projectWithTimeout(projectId, containerIds, includeFinancing);
            } catch (TimeoutException e) {
                throw new ProjectionTimeoutException(e);
            }
        });
    }

    @GetMapping("/{projectId}/loans/{loanId}/construction-schedule")
    public ResponseEntity<?> getConstructionSchedule(@PathVariable Long projectId, @PathVariable Long loanId) {
        return handle("loan " + loanId + " of project " + projectId,
                () -> constructionLoanService.schedule(projectId, loanId));
    }

    private <T> ResponseEntity<?> handle(String subject, Supplier<T> call) {
        try {
            return ResponseEntity.ok(call.get());
        } catch (NotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
        } catch (ValidationException e) {
            Map<String, Object> body = errorBody("VALIDATION_FAILED", e.getMessage());
            body.put("errors", e.getErrors());
            return ResponseEntity.badRequest().body(body);
        } catch (UnsupportedConfigurationException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "UNSUPPORTED_CONFIGURATION", e.getMessage());
        } catch (ProjectionTimeoutException e) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, "TIMEOUT", "Projection of " + subject + " timed out");
        } catch (CallNotPermittedException e) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, "DATA_UNAVAILABLE", e.getMessage());
        } catch (Exception e) {
            log.error("Error projecting {}", subject, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(errorBody(code, message));
    }

    private static Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }

    private static final class ProjectionTimeoutException extends RuntimeException {
        ProjectionTimeoutException(TimeoutException cause) {
            super(cause);
        }
    }
}
