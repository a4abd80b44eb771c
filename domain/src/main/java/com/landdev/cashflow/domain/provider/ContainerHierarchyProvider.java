package com.landdev.cashflow.domain.provider;

import com.landdev.cashflow.domain.model.Container;

import java.util.List;

/**
 * Read-only source of the division/phase hierarchy, including lotbank pricing on divisions
 */
public interface ContainerHierarchyProvider {

    List<Container> findContainers(Long projectId);
}
