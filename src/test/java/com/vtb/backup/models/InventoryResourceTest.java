package com.vtb.backup.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InventoryResourceTest {

    @Test
    void runningStateIsMatchedRegardlessOfCase() {
        assertTrue(resource("VM RUNNING").isRunning());
        assertTrue(resource("PowerState/running").isRunning());
        assertFalse(resource("VM deallocated").isRunning());
        assertFalse(resource(null).isRunning());
    }

    @Test
    void virtualMachineIsDefaultWorkloadClass() {
        assertEquals(WorkloadClass.VIRTUAL_MACHINE, resource("VM running").getWorkloadClass());
    }

    private static InventoryResource resource(String powerState) {
        return InventoryResource.builder()
            .id("/subscriptions/s1/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/vm1")
            .name("vm1")
            .powerState(powerState)
            .build();
    }
}
