package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.Container;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lookup over a project's division/phase tree
 */
public class ContainerHierarchy {

    /**
     * Product key for lots whose container cannot be traced to a division
     */
    public static final long UNASSIGNED_PRODUCT = 0L;

    static final String PROJECT_LEVEL_LABEL = "Project Level";

    private final Map<Long, Container> byId = new LinkedHashMap<>();

    public ContainerHierarchy(List<Container> containers) {
        for (Container container : containers) {
            byId.put(container.getContainerId(), container);
        }
    }

    public Container get(Long containerId) {
        return containerId != null ? byId.get(containerId) : null;
    }

    /**
     * Division a container rolls up to: itself for a division, its nearest tier-1 ancestor otherwise
     */
    public long divisionOf(Long containerId) {
        Container current = get(containerId);
        int guard = byId.size();
        while (current != null && guard-- >= 0) {
            if (current.isDivision()) {
                return current.getContainerId();
            }
            current = get(current.getParentId());
        }
        return UNASSIGNED_PRODUCT;
    }

    public String label(Long containerId) {
        if (containerId == null) {
            return PROJECT_LEVEL_LABEL;
        }
        Container container = get(containerId);
        return container != null && container.getName() != null ? container.getName() : "Container " + containerId;
    }

    public List<Container> divisions() {
        return byId.values().stream().filter(Container::isDivision).collect(Collectors.toList());
    }
}
