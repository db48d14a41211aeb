package com.vtb.backup.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CoverageRecord {
    String resourceId;
    String resourceName;
    String resourceGroup;
    String location;
    String powerState;
    WorkloadClass workloadClass;
    boolean isProtected;
    String method;
}
