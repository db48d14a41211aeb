package com.vtb.backup.cli;

import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.WorkloadClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InventoryLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsVirtualMachinesAndManagedDatabases() throws Exception {
        Path file = tempDir.resolve("inventory.json");
        Files.writeString(file, """
            [
              {"id":"/subscriptions/s1/resourceGroups/app/providers/Microsoft.Compute/virtualMachines/vm1",
               "name":"vm1","powerState":"VM running","tags":{"env":"prod"}},
              {"id":"/subscriptions/s1/resourceGroups/data/providers/Microsoft.Sql/servers/sql1/databases/orders",
               "name":"orders"},
              {"name":"without-id"}
            ]
            """);

        List<InventoryResource> resources = new InventoryLoader().load(file);

        assertEquals(2, resources.size());
        assertEquals(WorkloadClass.VIRTUAL_MACHINE, resources.get(0).getWorkloadClass());
        assertTrue(resources.get(0).isRunning());
        assertEquals(WorkloadClass.MANAGED_DATABASE, resources.get(1).getWorkloadClass());
    }

    @Test
    void noFileMeansEmptyInventory() throws Exception {
        assertTrue(new InventoryLoader().load(null).isEmpty());
    }
}
