package com.landdev.cashflow.domain.exception;

/**
 * Input is well formed but asks for behaviour the engine does not model,
 * e.g. a loan taken out by another loan or a revolver drawn on milestones
 */
public class UnsupportedConfigurationException extends ProjectionException {

    public UnsupportedConfigurationException(String message) {
        super(message);
    }
}
