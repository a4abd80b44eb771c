package com.landdev.cashflow.application.engine.lotbank;

import com.landdev.cashflow.domain.enums.AnalysisType;
import com.landdev.cashflow.domain.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves the stored analysis type of a project. Blank means the default land development analysis.
 */
@Component
public class AnalysisTypeResolver {

    private static final Logger log = LoggerFactory.getLogger(AnalysisTypeResolver.class);

    public AnalysisType resolve(String analysisType) {
        if (analysisType == null || analysisType.isBlank()) {
            return AnalysisType.DEFAULT;
        }
        String normalized = analysisType.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return AnalysisType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Unresolvable analysis type: {}", analysisType);
            throw new ValidationException("Unknown analysis type: " + analysisType);
        }
    }
}
