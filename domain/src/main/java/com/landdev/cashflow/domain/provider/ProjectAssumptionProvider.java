package com.landdev.cashflow.domain.provider;

import com.landdev.cashflow.domain.model.ProjectAssumptions;

import java.util.Optional;

/**
 * Read-only source of project and DCF assumptions
 */
public interface ProjectAssumptionProvider {

    /**
     * Get assumptions for a project
     * @param projectId The project identifier
     * @return Assumptions, or empty if the project does not exist
     */
    Optional<ProjectAssumptions> findAssumptions(Long projectId);
}
