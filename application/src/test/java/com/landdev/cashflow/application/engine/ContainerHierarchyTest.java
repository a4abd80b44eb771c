package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.Container;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainerHierarchyTest {

    private ContainerHierarchy hierarchy;

    @BeforeEach
    void setUp() {
        hierarchy = new ContainerHierarchy(List.of(
                Container.builder().containerId(1L).tier(1).name("North Village").build(),
                Container.builder().containerId(2L).parentId(1L).tier(2).name("Phase 1A").build(),
                Container.builder().containerId(3L).parentId(2L).tier(3).name("Block 7").build(),
                Container.builder().containerId(4L).parentId(99L).tier(2).name("Orphan").build()));
    }

    @Test
    void testDivisionOfWalksUpToTierOne() {
        assertEquals(1L, hierarchy.divisionOf(1L));
        assertEquals(1L, hierarchy.divisionOf(2L));
        assertEquals(1L, hierarchy.divisionOf(3L));
    }

    @Test
    void testDivisionOfUnknownIsUnassigned() {
        assertEquals(ContainerHierarchy.UNASSIGNED_PRODUCT, hierarchy.divisionOf(4L));
        assertEquals(ContainerHierarchy.UNASSIGNED_PRODUCT, hierarchy.divisionOf(null));
        assertEquals(ContainerHierarchy.UNASSIGNED_PRODUCT, hierarchy.divisionOf(42L));
    }

    @Test
    void testLabels() {
        assertEquals("Phase 1A", hierarchy.label(2L));
        assertEquals("Project Level", hierarchy.label(null));
        assertEquals("Container 42", hierarchy.label(42L));
    }

    @Test
    void testDivisions() {
        assertEquals(1, hierarchy.divisions().size());
        assertEquals("North Village", hierarchy.divisions().get(0).getName());
    }
}
