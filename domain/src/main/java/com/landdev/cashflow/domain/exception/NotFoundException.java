package com.landdev.cashflow.domain.exception;

/**
 * A project, loan or dataset that the caller referenced does not exist
 */
public class NotFoundException extends ProjectionException {

    private final String entityType;
    private final Object entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public Object getEntityId() {
        return entityId;
    }
}
