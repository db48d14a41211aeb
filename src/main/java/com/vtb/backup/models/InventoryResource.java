package com.vtb.backup.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Ресурс из внешнего инвентаря (ВМ или управляемая БД)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InventoryResource {
    private String id;
    private String name;
    private String resourceGroup;
    private String location;
    private String powerState;
    private String subscriptionId;
    @Builder.Default
    private WorkloadClass workloadClass = WorkloadClass.VIRTUAL_MACHINE;

    public boolean isRunning() {
        return powerState != null && powerState.toLowerCase(Locale.ROOT).contains("running");
    }
}
